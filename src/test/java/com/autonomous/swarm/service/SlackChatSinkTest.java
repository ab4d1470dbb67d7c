package com.autonomous.swarm.service;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SlackChatSinkTest {

    @Mock
    private Slack slack;

    @Mock
    private MethodsClient methods;

    private SlackChatSink slackChatSink;

    @BeforeEach
    void setUp() {
        slackChatSink = new SlackChatSink(slack);
        slackChatSink.setSlackBotToken("xoxb-test");
    }

    @Test
    void shouldPostToConfiguredChannel() throws IOException, SlackApiException {
        slackChatSink.setChannel("C123");
        ChatPostMessageResponse response = new ChatPostMessageResponse();
        response.setOk(true);
        when(slack.methods("xoxb-test")).thenReturn(methods);
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenReturn(response);

        slackChatSink.send("[build] Approved: Continue?", ChatNotifier.SOURCE);

        verify(methods).chatPostMessage(argThat((ChatPostMessageRequest request) ->
            "C123".equals(request.getChannel()) && "[build] Approved: Continue?".equals(request.getText())));
    }

    @Test
    void shouldDropMessageWithoutChannel() {
        slackChatSink.setChannel("");

        slackChatSink.send("hello", ChatNotifier.SOURCE);

        verifyNoInteractions(slack);
    }

    @Test
    void shouldNotPropagateSlackFailures() throws IOException, SlackApiException {
        slackChatSink.setChannel("C123");
        when(slack.methods("xoxb-test")).thenReturn(methods);
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenThrow(new IOException("network down"));

        assertDoesNotThrow(() -> slackChatSink.send("hello", ChatNotifier.SOURCE));
    }
}
