package com.gatewayadmin.admin.route;

import com.fasterxml.jackson.databind.JsonNode;
import com.gatewayadmin.admin.error.NotFoundException;
import com.gatewayadmin.admin.model.Route;
import com.gatewayadmin.admin.web.OperatorResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/routes")
public class RouteController {

    private final RouteService service;
    private final OperatorResolver operators;

    public RouteController(RouteService service, OperatorResolver operators) {
        this.service = service;
        this.operators = operators;
    }

    @GetMapping
    public List<Route> list(@RequestParam(required = false) Boolean enabled) {
        return service.list(enabled);
    }

    @GetMapping("/{id}")
    public Route get(@PathVariable long id) {
        return service.find(id).orElseThrow(() -> NotFoundException.route(id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Route create(@RequestBody JsonNode body, HttpServletRequest request) {
        return service.create(body, operators.resolve(request));
    }

    @PutMapping("/{id}")
    public Route update(@PathVariable long id, @RequestBody JsonNode body, HttpServletRequest request) {
        return service.update(id, body, operators.resolve(request));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable long id, HttpServletRequest request) {
        service.delete(id, operators.resolve(request));
    }
}
