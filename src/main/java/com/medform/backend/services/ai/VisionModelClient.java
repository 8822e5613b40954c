package com.medform.backend.services.ai;

public interface VisionModelClient {

    /**
     * Sends one instruction plus one page image and returns the model's JSON reply.
     *
     * @param imageDataUrl {@code data:image/png;base64,...}
     */
    VisionReply complete(String instruction, String imageDataUrl);
}
