package com.phillippitts.swarmcouncil.service.provider;

/** Wire protocol spoken by a provider backend. */
public enum ProviderKind {
    /** OpenAI-compatible {@code /chat/completions} endpoint (OpenAI, DeepSeek, ChindaX, Qwen). */
    CHAT_COMPLETIONS,
    /** Google Generative Language {@code models/{model}:generateContent} endpoint. */
    GEMINI
}
