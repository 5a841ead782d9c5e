package com.intelhub.backend.ai.classification;

import com.intelhub.backend.ai.entity.AiUsageLog;
import com.intelhub.backend.ai.service.AiUsageMonitoringService;
import com.intelhub.backend.config.AiProviderProperties;
import com.intelhub.backend.exception.AiProviderException;
import java.time.LocalDate;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.stereotype.Service;

/**
 * Classifier backed by a Spring AI {@link ChatModel}. One call per item, no batching.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatModelIntelligenceClassifier implements IntelligenceClassifier {

    private final ChatModel chatModel;
    private final PromptTemplates promptTemplates;
    private final ClassificationResultParser parser;
    private final AiProviderProperties aiProviderProperties;
    private final AiUsageMonitoringService usageMonitoringService;

    @Override
    public ClassificationOutcome classify(ClassificationRequest request) {
        String promptVersion = request.getPromptVersion();
        LocalDate referenceDate = request.getReferenceDate() != null ? request.getReferenceDate() : LocalDate.now();

        PromptTemplate promptTemplate = new PromptTemplate(promptTemplates.get(promptVersion));
        Prompt prompt = promptTemplate.create(
                Map.of(
                        "referenceDate", referenceDate.toString(),
                        "schema", promptTemplates.schema(promptVersion),
                        "content", request.getText() != null ? request.getText() : ""
                ),
                ChatOptions.builder()
                        .model(aiProviderProperties.getChatModel())
                        .temperature(aiProviderProperties.getTemperature())
                        .build());

        int tokenCount = AiUsageMonitoringService.estimateTokenCount(prompt.getContents());
        log.debug("🤖 Classifying item {} with prompt {} (~{} tokens)", request.getUuid(), promptVersion, tokenCount);

        ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (RuntimeException e) {
            usageMonitoringService.record(AiUsageLog.Operation.CLASSIFY, aiProviderProperties.getChatModel(),
                    request.getUuid(), tokenCount, false, e.getMessage());
            throw new AiProviderException(aiProviderProperties.getProvider(),
                    "AI call failed for item " + request.getUuid() + ": " + e.getMessage(), e);
        }

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            usageMonitoringService.record(AiUsageLog.Operation.CLASSIFY, aiProviderProperties.getChatModel(),
                    request.getUuid(), tokenCount, false, "Empty response");
            throw new AiProviderException(aiProviderProperties.getProvider(),
                    "AI returned no output for item " + request.getUuid());
        }

        String model = resolveModel(response);
        String aiResponse = response.getResult().getOutput().getText();
        ClassificationOutcome outcome = parser.parse(aiResponse);

        usageMonitoringService.record(AiUsageLog.Operation.CLASSIFY, model, request.getUuid(),
                tokenCount + AiUsageMonitoringService.estimateTokenCount(aiResponse),
                outcome.isValid(), outcome.getError());

        if (outcome.isValid()) {
            ClassificationResult result = outcome.getResult();
            result.setProvider(aiProviderProperties.getProvider());
            result.setModel(model);
            result.setPromptVersion(promptVersion);
        }
        return outcome;
    }

    private String resolveModel(ChatResponse response) {
        if (response.getMetadata() != null) {
            String model = response.getMetadata().getModel();
            if (model != null && !model.isBlank()) {
                return model;
            }
        }
        return aiProviderProperties.getChatModel();
    }
}
