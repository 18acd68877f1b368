package com.minicall.common.web;

import com.minicall.calling.command.CallingException;
import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void handleNoResourceFound_ShouldReturn404ResultEnvelope() {
        ResponseEntity<Result<Void>> resp = handler.handleNoResourceFound(new NoResourceFoundException(HttpMethod.POST, "calls/unknown"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.NOT_FOUND);
    }

    @Test
    void handleCalling_ShouldReturnConflictWithReason() {
        ResponseEntity<Result<Void>> resp = handler.handleCalling(new CallingException("call_already_active"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.CONFLICT);
        assertThat(resp.getBody().message()).isEqualTo("call_already_active");
    }

    @Test
    void handleCompletion_ShouldUnwrapCause() {
        ResponseEntity<Result<Void>> conflict = handler.handleCompletion(
                new CompletionException(new CallingException("no_active_call")));
        assertThat(conflict.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(conflict.getBody().message()).isEqualTo("no_active_call");

        ResponseEntity<Result<Void>> failed = handler.handleCompletion(
                new CompletionException(new IllegalStateException("calling service down")));
        assertThat(failed.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(failed.getBody().code()).isEqualTo(ApiCodes.INTERNAL_ERROR);
    }
}
