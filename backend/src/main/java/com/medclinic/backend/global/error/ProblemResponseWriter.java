package com.medclinic.backend.global.error;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Renders {@link ProblemResponse} bodies from servlet filters, where the controller advice
 * does not apply.
 */
@Component
public class ProblemResponseWriter {

    private final ObjectMapper objectMapper;

    public ProblemResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletRequest request, HttpServletResponse response,
                      HttpStatus status, String code, String detail) throws IOException {
        write(response, ProblemResponse.of(status, code, detail, request.getRequestURI()));
    }

    public void writeRetryable(HttpServletRequest request, HttpServletResponse response,
                               HttpStatus status, String code, String detail, long retryAfterSeconds) throws IOException {
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds));
        write(response, ProblemResponse.of(status, code, detail, request.getRequestURI(), retryAfterSeconds));
    }

    public void write(HttpServletRequest request, HttpServletResponse response, ProblemException problem) throws IOException {
        HttpStatus status = HttpStatus.valueOf(problem.getStatusCode().value());
        if (problem.getRetryAfterSeconds() != null) {
            writeRetryable(request, response, status, problem.getCode(), problem.getDetailMessage(),
                    problem.getRetryAfterSeconds());
        } else {
            write(request, response, status, problem.getCode(), problem.getDetailMessage());
        }
    }

    private void write(HttpServletResponse response, ProblemResponse body) throws IOException {
        response.setStatus(body.status());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
