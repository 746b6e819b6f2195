package com.lihtcmate.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicReference;

import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    @DisplayName("property-scoped requests carry the request and property ids in the MDC")
    void doFilter_populatesMdc() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST",
                "/api/properties/0F8FAD5B-D9CB-469F-A165-70867728950E/compliance/finalize");
        request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, " upload-42 ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenRequestId = new AtomicReference<>();
        AtomicReference<String> seenPropertyId = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain() {
            @Override
            public void doFilter(ServletRequest req, ServletResponse res) {
                seenRequestId.set(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY));
                seenPropertyId.set(MDC.get(RequestIdFilter.PROPERTY_ID_MDC_KEY));
            }
        });

        assertThat(seenRequestId.get()).isEqualTo("upload-42");
        assertThat(seenPropertyId.get()).isEqualTo("0f8fad5b-d9cb-469f-a165-70867728950e");
        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).isEqualTo("upload-42");
        assertThat(MDC.get(RequestIdFilter.REQUEST_ID_MDC_KEY)).isNull();
        assertThat(MDC.get(RequestIdFilter.PROPERTY_ID_MDC_KEY)).isNull();
    }

    @Test
    void doFilter_generatesIdWhenHeaderMissing() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/healthz"), response, new MockFilterChain());

        assertThat(response.getHeader(RequestIdFilter.REQUEST_ID_HEADER)).hasSize(36);
    }

    @Test
    void propertyIdOf_ignoresOtherRoutes() {
        assertThat(RequestIdFilter.propertyIdOf("/api/leases/0f8fad5b-d9cb-469f-a165-70867728950e/ami-bucket")).isNull();
        assertThat(RequestIdFilter.propertyIdOf("/api/properties")).isNull();
        assertThat(RequestIdFilter.propertyIdOf("/api/properties/0f8fad5b-d9cb-469f-a165-70867728950e"))
                .isEqualTo("0f8fad5b-d9cb-469f-a165-70867728950e");
    }
}
