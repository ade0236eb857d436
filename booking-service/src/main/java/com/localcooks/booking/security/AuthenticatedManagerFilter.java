package com.localcooks.booking.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.localcooks.common.dto.BaseResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Turns the manager id forwarded by the gateway into a {@link ManagerPrincipal} request attribute
 * and puts it into MDC for the duration of the request. Manager endpoints without a valid id get 401.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthenticatedManagerFilter extends OncePerRequestFilter {

    public static final String MANAGER_ID_HEADER = "X-Authenticated-Manager-Id";
    public static final String PRINCIPAL_ATTRIBUTE = ManagerPrincipal.class.getName();
    static final String MANAGER_PATH_PREFIX = "/api/manager/";
    private static final String MDC_MANAGER_ID = "managerId";

    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith(MANAGER_PATH_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Long managerId = parseManagerId(request.getHeader(MANAGER_ID_HEADER));
        if (managerId == null) {
            log.warn("Rejected {} {}: missing or invalid {}", request.getMethod(), request.getRequestURI(), MANAGER_ID_HEADER);
            response.setStatus(HttpStatus.UNAUTHORIZED.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(),
                    BaseResponse.error("Authentication required", "UNAUTHENTICATED"));
            return;
        }
        try {
            MDC.put(MDC_MANAGER_ID, String.valueOf(managerId));
            request.setAttribute(PRINCIPAL_ATTRIBUTE, new ManagerPrincipal(managerId));
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_MANAGER_ID);
        }
    }

    private Long parseManagerId(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long id = Long.parseLong(header.trim());
            return id > 0 ? id : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
