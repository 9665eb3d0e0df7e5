package com.example.OfferScan;

import com.example.OfferScan.service.OfferExtractionPipeline;
import org.junit.jupiter.api.Test;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(
        properties = {
                "spring.ai.model.chat=none",
                "spring.ai.model.embedding=none",
                "spring.ai.model.image=none",
                "spring.ai.model.audio.speech=none",
                "spring.ai.model.audio.transcription=none",
                "spring.ai.model.moderation=none",
                "spring.ai.openai.api-key=test"
        }
)
@ActiveProfiles("test")
class OfferScanApplicationTests {

    @MockBean
    private OpenAiChatModel openAiChatModel;

    @Autowired
    private OfferExtractionPipeline pipeline;

    @Test
    void contextLoads() {
        assertNotNull(pipeline);
    }
}
