package com.platform.relay.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.relay.error.ErrorCode;
import com.platform.relay.error.ErrorResponse;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes {@link ErrorResponse} bodies from servlet filters, which run outside the MVC exception handler.
 */
@Component
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;

    public ErrorResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletResponse response, ErrorResponse body) throws IOException {
        response.setStatus(body.getStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
    }

    public void write(HttpServletResponse response, ErrorCode code, int status, String path) throws IOException {
        write(response, ErrorResponse.of(code, status, path, MDC.get("trace_id")));
    }
}
