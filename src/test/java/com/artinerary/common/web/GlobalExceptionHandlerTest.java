package com.artinerary.common.web;

import com.artinerary.common.api.ApiCodes;
import com.artinerary.common.api.Result;
import com.artinerary.domain.exception.EngagementError;
import com.artinerary.domain.exception.EngagementException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void handleNoResourceFound_ShouldReturn404ResultEnvelope() {
        ResponseEntity<Result<Void>> resp = handler.handleNoResourceFound(new NoResourceFoundException(HttpMethod.POST, "event/nope"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.NOT_FOUND);
    }

    @Test
    void handleEngagement_ShouldMapCategoryToStatusAndCode() {
        assertEngagement(EngagementError.INVALID_MESSAGE, HttpStatus.BAD_REQUEST, ApiCodes.BAD_REQUEST);
        assertEngagement(EngagementError.ALREADY_JOINED, HttpStatus.CONFLICT, ApiCodes.CONFLICT);
        assertEngagement(EngagementError.HOST_CANNOT_LEAVE, HttpStatus.FORBIDDEN, ApiCodes.FORBIDDEN);
        assertEngagement(EngagementError.NOT_FOUND, HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND);
    }

    @Test
    void handleEngagement_ShouldNotLeakDetail() {
        ResponseEntity<Result<Void>> resp = handler.handleEngagement(
                EngagementException.of(EngagementError.VALIDATION_ERROR, "too_many_stops"));

        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().message()).isEqualTo("validation_error");
    }

    @Test
    void handleAny_ShouldReturnInternalError() {
        ResponseEntity<Result<Void>> resp = handler.handleAny(new IllegalStateException("boom"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().message()).isEqualTo("internal_error");
    }

    private void assertEngagement(EngagementError error, HttpStatus status, int code) {
        ResponseEntity<Result<Void>> resp = handler.handleEngagement(EngagementException.of(error));
        assertThat(resp.getStatusCode()).isEqualTo(status);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().code()).isEqualTo(code);
        assertThat(resp.getBody().message()).isEqualTo(error.getKey());
    }
}
