package com.example.OfferScan.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AiExtractionConfig {

    @Bean
    public ChatClient offerExtractionChatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }
}
