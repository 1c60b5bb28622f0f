package com.gatewayadmin.admin.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.gatewayadmin.admin.error.NotFoundException;
import com.gatewayadmin.admin.model.Backend;
import com.gatewayadmin.admin.web.OperatorResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/backends")
public class BackendController {

    private final BackendService service;
    private final OperatorResolver operators;

    public BackendController(BackendService service, OperatorResolver operators) {
        this.service = service;
        this.operators = operators;
    }

    @GetMapping
    public List<Backend> list(@RequestParam(required = false) Boolean enabled) {
        return service.list(enabled);
    }

    @GetMapping("/{name}")
    public Backend get(@PathVariable String name) {
        return service.find(name).orElseThrow(() -> NotFoundException.backend(name));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Backend create(@RequestBody JsonNode body, HttpServletRequest request) {
        return service.create(body, operators.resolve(request));
    }

    @PutMapping("/{name}")
    public Backend update(@PathVariable String name, @RequestBody JsonNode body, HttpServletRequest request) {
        return service.update(name, body, operators.resolve(request));
    }

    @DeleteMapping("/{name}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String name, HttpServletRequest request) {
        service.delete(name, operators.resolve(request));
    }
}
