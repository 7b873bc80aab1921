package com.climaterisklens.alerts;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebhookNotifierTest {
    private final ObjectMapper om = new ObjectMapper();
    private final HttpClient http = mock(HttpClient.class);

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status) {
        HttpResponse<String> resp = mock(HttpResponse.class);
        when(resp.statusCode()).thenReturn(status);
        return resp;
    }

    private ObjectNode payload() {
        return om.createObjectNode().put("message", "flood risk \u2014 high");
    }

    @Test
    void successOnFirstAttempt() throws Exception {
        HttpResponse<String> ok = response(204);
        doReturn(ok).when(http).send(any(HttpRequest.class), any());
        WebhookNotifier notifier = new WebhookNotifier(http, om, 5, 3, 0L);

        assertThat(notifier.send("https://hooks.example.com/a", payload()), is(true));

        ArgumentCaptor<HttpRequest> req = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http, times(1)).send(req.capture(), any());
        assertThat(req.getValue().method(), is("POST"));
        assertThat(req.getValue().headers().firstValue("Content-Type").orElse(""), is("application/json"));
    }

    @Test
    void retriesUntilSuccess() throws Exception {
        HttpResponse<String> fail = response(500);
        HttpResponse<String> ok = response(200);
        doThrow(new IOException("reset")).doReturn(fail).doReturn(ok).when(http).send(any(HttpRequest.class), any());
        WebhookNotifier notifier = new WebhookNotifier(http, om, 5, 3, 0L);

        assertThat(notifier.send("https://hooks.example.com/a", payload()), is(true));
        verify(http, times(3)).send(any(HttpRequest.class), any());
    }

    @Test
    void givesUpAfterMaxAttempts() throws Exception {
        HttpResponse<String> fail = response(503);
        doReturn(fail).when(http).send(any(HttpRequest.class), any());
        WebhookNotifier notifier = new WebhookNotifier(http, om, 5, 2, 0L);

        assertThat(notifier.send("https://hooks.example.com/a", payload()), is(false));
        verify(http, times(2)).send(any(HttpRequest.class), any());
    }

    @Test
    void malformedUrlFailsWithoutCalling() throws Exception {
        WebhookNotifier notifier = new WebhookNotifier(http, om, 5, 3, 0L);
        assertThat(notifier.send("not a url", payload()), is(false));
        verify(http, never()).send(any(HttpRequest.class), any());
    }
}
