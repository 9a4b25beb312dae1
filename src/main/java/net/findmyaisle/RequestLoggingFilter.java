/**
 * Request logging and timing filter for API requests
 *
 * Features:
 * - Logs incoming API requests with method, URI and source IP
 * - Measures and logs request processing duration with the response status
 */
package net.findmyaisle;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest req = (HttpServletRequest) request;
        String uri = req.getRequestURI();
        if (!uri.startsWith("/api")) {
            chain.doFilter(request, response);
            return;
        }
        long startTime = System.currentTimeMillis();
        String query = req.getQueryString();
        logger.info("Incoming request: {} {}{} from {}", req.getMethod(), uri,
            query == null ? "" : "?" + query, req.getRemoteAddr());
        chain.doFilter(request, response);
        long duration = System.currentTimeMillis() - startTime;
        int status = response instanceof HttpServletResponse httpResponse ? httpResponse.getStatus() : 0;
        logger.info("Completed request: {} {} with status {} in {} ms", req.getMethod(), uri, status, duration);
    }
}
