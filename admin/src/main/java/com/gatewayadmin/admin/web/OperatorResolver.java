package com.gatewayadmin.admin.web;

import com.gatewayadmin.admin.config.GatewayAdminProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Reads the free-text operator identity from the configured request header.
 * There is no authentication behind it.
 */
@Component
public class OperatorResolver {

    private final String header;

    public OperatorResolver(GatewayAdminProperties props) {
        this.header = props.getOperatorHeader();
    }

    public String resolve(HttpServletRequest request) {
        String v = request.getHeader(header);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
