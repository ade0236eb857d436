package com.localcooks.booking.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class AuthenticatedManagerFilterTest {

    private final AuthenticatedManagerFilter filter = new AuthenticatedManagerFilter(new ObjectMapper().findAndRegisterModules());

    private static MockHttpServletRequest managerRequest(String managerId) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/manager/bookings/42/decision");
        if (managerId != null) {
            request.addHeader(AuthenticatedManagerFilter.MANAGER_ID_HEADER, managerId);
        }
        return request;
    }

    @Test
    @DisplayName("a valid header becomes the request principal")
    void validHeader_setsPrincipal() throws Exception {
        // given
        MockHttpServletRequest request = managerRequest("5");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        // when
        filter.doFilter(request, response, chain);

        // then
        assertThat(chain.getRequest()).isNotNull();
        assertThat(request.getAttribute(AuthenticatedManagerFilter.PRINCIPAL_ATTRIBUTE))
                .isEqualTo(new ManagerPrincipal(5L));
        assertThat(MDC.get("managerId")).isNull();
    }

    @Test
    @DisplayName("missing, malformed or non-positive ids are rejected with 401")
    void invalidHeader_isUnauthorized() throws Exception {
        for (String header : new String[]{null, "", "abc", "0", "-3"}) {
            MockHttpServletResponse response = new MockHttpServletResponse();
            MockFilterChain chain = new MockFilterChain();

            filter.doFilter(managerRequest(header), response, chain);

            assertThat(response.getStatus()).as("header %s", header).isEqualTo(401);
            assertThat(response.getContentAsString()).contains("UNAUTHENTICATED");
            assertThat(chain.getRequest()).isNull();
        }
    }

    @Test
    @DisplayName("paths outside the manager API pass through untouched")
    void otherPaths_areNotFiltered() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isSameAs(request);
    }
}
