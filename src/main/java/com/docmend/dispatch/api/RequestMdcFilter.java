package com.docmend.dispatch.api;

import com.docmend.core.logging.MdcContext;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Tags every request thread with a short request id for log correlation and
 * echoes it back in the {@code X-Request-Id} header.
 */
@Component
@Order(1)
public class RequestMdcFilter implements Filter {

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        String requestId = MdcContext.startRequest();
        if (response instanceof HttpServletResponse httpResponse) {
            httpResponse.setHeader("X-Request-Id", requestId);
        }
        try {
            chain.doFilter(request, response);
        } finally {
            MdcContext.clear();
        }
    }
}
