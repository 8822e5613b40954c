package com.medform.backend.services.ai;

import java.time.Duration;
import java.util.List;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionContentPartImage;
import com.openai.models.chat.completions.ChatCompletionContentPartText;
import com.openai.models.chat.completions.ChatCompletionCreateParams;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OpenAiVisionClient implements VisionModelClient {

    private final VisionProperties properties;

    private volatile OpenAIClient client;

    public OpenAiVisionClient(VisionProperties properties) {
        this.properties = properties;
    }

    @Override
    public VisionReply complete(String instruction, String imageDataUrl) {
        if (!properties.hasApiKey()) {
            throw new IllegalStateException("OpenAI API key is not configured (medform.vision.api-key)");
        }

        OpenAIClient c = getOrCreateClient(properties.getApiKey().trim());

        ChatCompletionContentPartText textPart = ChatCompletionContentPartText.builder()
                .text(instruction)
                .build();
        ChatCompletionContentPartImage imagePart = ChatCompletionContentPartImage.builder()
                .imageUrl(ChatCompletionContentPartImage.ImageUrl.builder()
                        .url(imageDataUrl)
                        .detail(ChatCompletionContentPartImage.ImageUrl.Detail.HIGH)
                        .build())
                .build();

        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(properties.getModel())
                .addUserMessageOfArrayOfContentParts(List.of(
                        ChatCompletionContentPart.ofText(textPart),
                        ChatCompletionContentPart.ofImageUrl(imagePart)))
                .maxCompletionTokens(properties.getMaxTokens())
                .temperature(properties.getTemperature())
                .responseFormat(ResponseFormatJsonObject.builder().build())
                .build();

        long start = System.currentTimeMillis();
        ChatCompletion completion = c.chat().completions().create(params);
        long elapsed = System.currentTimeMillis() - start;

        String text = completion.choices().isEmpty()
                ? ""
                : completion.choices().get(0).message().content().orElse("");
        long tokens = completion.usage().map(u -> u.totalTokens()).orElse(0L);

        log.info("[Vision] Model replied (model={} tokens={} elapsedMs={} replyLen={})",
                properties.getModel(), tokens, elapsed, text.length());
        return new VisionReply(text, tokens, properties.getModel());
    }

    private OpenAIClient getOrCreateClient(String key) {
        OpenAIClient current = client;
        if (current != null) return current;

        synchronized (this) {
            if (client != null) return client;
            client = OpenAIOkHttpClient.builder()
                    .apiKey(key)
                    .timeout(Duration.ofSeconds(Math.max(1, properties.getTimeoutSeconds())))
                    .build();
            return client;
        }
    }
}
