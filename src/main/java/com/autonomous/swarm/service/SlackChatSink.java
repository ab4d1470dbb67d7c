package com.autonomous.swarm.service;

import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Posts coordinator messages to a Slack channel.
 */
@Slf4j
@Service
@ConditionalOnProperty("slack.bot.token")
public class SlackChatSink implements ChatMessageSink {

    @Value("${slack.bot.token}")
    private String slackBotToken;

    @Value("${slack.channel:}")
    private String channel;

    private final Slack slack;

    public SlackChatSink() {
        this(Slack.getInstance());
    }

    SlackChatSink(Slack slack) {
        this.slack = slack;
    }

    void setChannel(String channel) {
        this.channel = channel;
    }

    void setSlackBotToken(String slackBotToken) {
        this.slackBotToken = slackBotToken;
    }

    @Override
    public void send(String text, String source) {
        if (channel == null || channel.isBlank()) {
            log.warn("slack.channel is not set, dropping {} message", source);
            return;
        }
        try {
            MethodsClient methods = slack.methods(slackBotToken);

            ChatPostMessageRequest request = ChatPostMessageRequest.builder()
                .channel(channel)
                .text(text)
                .build();

            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (!response.isOk()) {
                log.warn("Failed to post {} message: {}", source, response.getError());
            }
        } catch (IOException | SlackApiException e) {
            log.warn("Failed to post {} message: {}", source, e.getMessage());
        }
    }
}
