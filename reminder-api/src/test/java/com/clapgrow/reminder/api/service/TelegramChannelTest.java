package com.clapgrow.reminder.api.service;

import com.clapgrow.reminder.common.channel.ChannelErrorCategory;
import com.clapgrow.reminder.common.channel.ChannelSendException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TelegramChannelTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private TelegramChannel channel(HttpStatus status, String body, String token) {
        WebClient webClient = WebClient.builder()
            .baseUrl("https://api.telegram.org/bot" + token)
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        return new TelegramChannel(webClient, new ObjectMapper(), token, 5);
    }

    @Test
    void testSendText_Ok_PostsToSendMessage() {
        TelegramChannel channel = channel(HttpStatus.OK, "{\"ok\":true,\"result\":{\"message_id\":7}}", "123:abc");

        long messageId = channel.sendText(42L, "⏰ Reminder: Pay rent");

        assertEquals(7L, messageId);
        assertEquals(1, requests.size());
        assertEquals("/bot123:abc/sendMessage", requests.get(0).url().getPath());
    }

    @Test
    void testCopyMessage_Ok_PostsToCopyMessage() {
        TelegramChannel channel = channel(HttpStatus.OK, "{\"ok\":true,\"result\":{\"message_id\":8}}", "123:abc");

        channel.copyMessage(42L, -1001L, 15L);

        assertTrue(requests.get(0).url().getPath().endsWith("/copyMessage"));
    }

    @Test
    void testEditMessageText_Ok_PostsToEditMessageText() {
        TelegramChannel channel = channel(HttpStatus.OK, "{\"ok\":true,\"result\":{\"message_id\":11}}", "123:abc");

        channel.editMessageText(-1001L, 11L, "Full description\n🔔 Alert ringed.");

        assertTrue(requests.get(0).url().getPath().endsWith("/editMessageText"));
    }

    @Test
    void testEditMessageCaption_ResultIsPlainTrue_Succeeds() {
        TelegramChannel channel = channel(HttpStatus.OK, "{\"ok\":true,\"result\":true}", "123:abc");

        assertDoesNotThrow(() -> channel.editMessageCaption(-1001L, 10L, "caption"));
        assertTrue(requests.get(0).url().getPath().endsWith("/editMessageCaption"));
    }

    @Test
    void testEditMessageText_NotModified_IsPermanent() {
        TelegramChannel channel = channel(HttpStatus.BAD_REQUEST,
            "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: message can't be edited\"}", "123:abc");

        ChannelSendException error = assertThrows(ChannelSendException.class,
            () -> channel.editMessageText(-1001L, 11L, "text"));

        assertEquals(ChannelErrorCategory.PERMANENT, error.getCategory());
    }

    @Test
    void testSendText_EmptyOkResponse_IsTemporaryFailure() {
        TelegramChannel channel = channel(HttpStatus.OK, "", "123:abc");

        ChannelSendException error = assertThrows(ChannelSendException.class, () -> channel.sendText(42L, "hi"));

        assertEquals(ChannelErrorCategory.TEMPORARY, error.getCategory());
        assertEquals("Telegram sendMessage failed: empty response", error.getMessage());
    }

    @Test
    void testSendText_TooManyRequestsWithParameters_IsRateLimited() {
        TelegramChannel channel = channel(HttpStatus.TOO_MANY_REQUESTS,
            "{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests: retry after 12\",\"parameters\":{\"retry_after\":14}}",
            "123:abc");

        ChannelSendException error = assertThrows(ChannelSendException.class, () -> channel.sendText(42L, "hi"));

        assertTrue(error.isRateLimited());
        assertEquals(14, error.getRetryAfterSeconds());
        assertEquals(429, error.getHttpStatusCode());
        assertTrue(error.getMessage().contains("Too Many Requests"));
    }

    @Test
    void testSendText_TooManyRequestsWithoutParameters_ParsesDescription() {
        TelegramChannel channel = channel(HttpStatus.TOO_MANY_REQUESTS,
            "{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests: retry after 9\"}", "123:abc");

        ChannelSendException error = assertThrows(ChannelSendException.class, () -> channel.sendText(42L, "hi"));

        assertEquals(ChannelErrorCategory.RATE_LIMIT, error.getCategory());
        assertEquals(9, error.getRetryAfterSeconds());
    }

    @Test
    void testSendText_Forbidden_IsPermanent() {
        TelegramChannel channel = channel(HttpStatus.FORBIDDEN,
            "{\"ok\":false,\"error_code\":403,\"description\":\"Forbidden: bot was blocked by the user\"}", "123:abc");

        ChannelSendException error = assertThrows(ChannelSendException.class, () -> channel.sendText(42L, "hi"));

        assertEquals(ChannelErrorCategory.PERMANENT, error.getCategory());
        assertFalse(error.isRateLimited());
        assertEquals("Telegram sendMessage failed: 403 Forbidden: bot was blocked by the user", error.getMessage());
    }

    @Test
    void testSendText_ServerErrorWithoutJson_IsTemporary() {
        TelegramChannel channel = channel(HttpStatus.BAD_GATEWAY, "<html>Bad Gateway</html>", "123:abc");

        ChannelSendException error = assertThrows(ChannelSendException.class, () -> channel.sendText(42L, "hi"));

        assertEquals(ChannelErrorCategory.TEMPORARY, error.getCategory());
    }

    @Test
    void testSendText_TokenNotConfigured_FailsWithoutCalling() {
        TelegramChannel channel = channel(HttpStatus.OK, "{\"ok\":true}", "");

        ChannelSendException error = assertThrows(ChannelSendException.class, () -> channel.sendText(42L, "hi"));

        assertFalse(channel.isConfigured());
        assertEquals(ChannelErrorCategory.AUTH, error.getCategory());
        assertTrue(requests.isEmpty());
    }

    @Test
    void testParseRetryAfter_VariousDescriptions() {
        assertEquals(30, TelegramChannel.parseRetryAfter("Too Many Requests: retry after 30"));
        assertNull(TelegramChannel.parseRetryAfter("Bad Request: chat not found"));
        assertNull(TelegramChannel.parseRetryAfter(null));
    }
}
