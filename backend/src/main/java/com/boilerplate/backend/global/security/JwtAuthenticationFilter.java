package com.boilerplate.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.boilerplate.backend.global.error.ErrorResponse;
import com.boilerplate.backend.global.security.GateDecision.Authenticated;
import com.boilerplate.backend.global.security.GateDecision.Rejected;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet adapter for {@link RequestGate}: every request outside the excluded paths must carry a
 * valid token, otherwise it is answered here with a JSON error and never reaches a controller.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final RequestGate requestGate;
    private final ObjectMapper objectMapper;

    public JwtAuthenticationFilter(RequestGate requestGate, ObjectMapper objectMapper) {
        this.requestGate = requestGate;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        GateDecision decision = requestGate.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));

        if (decision instanceof Rejected rejected) {
            SecurityContextHolder.clearContext();
            logRejection(request, rejected);
            writeRejection(response, rejected);
            return;
        }

        RequestIdentity identity = ((Authenticated) decision).identity();
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(identity, null, List.of());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        request.setAttribute(RequestIdentity.REQUEST_ATTRIBUTE, identity);

        log.debug("Authenticated {} {} as userId={} username={}",
                request.getMethod(), resolvePath(request), identity.userId(), identity.username());

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = resolvePath(request);
        boolean excluded = requestGate.isExcluded(path);
        if (excluded) {
            log.debug("Excluded from token validation: {} {}", request.getMethod(), path);
        }
        return excluded;
    }

    static String resolvePath(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (uri != null && contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    private void logRejection(HttpServletRequest request, Rejected rejected) {
        if (rejected.kind() == GateErrorKind.SERVER_MISCONFIGURED) {
            log.error("Rejected {} {}: jwt.key is missing or too short", request.getMethod(), resolvePath(request));
            return;
        }
        log.warn("Rejected {} {}: {} ({})",
                request.getMethod(), resolvePath(request), rejected.kind(), rejected.message());
    }

    private void writeRejection(HttpServletResponse response, Rejected rejected) throws IOException {
        ErrorResponse body = ErrorResponse.of(rejected.kind().status(), rejected.kind().name(), rejected.message());
        response.setStatus(rejected.kind().status().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
