package com.flowys.flowys_backend.model.llm;

/**
 * Provider-agnostic response returned by every LlmClient.
 * Clients never throw for provider-side failures; they return {@link #error(String, int)}.
 */
public class LlmResponse {

    private boolean success;
    private String  rawText;       // exact text the model returned
    private String  errorMessage;  // populated if success = false
    private int     statusCode;    // HTTP status of a failed call, 0 when no response was received
    private int     inputTokens;
    private int     outputTokens;
    private String  model;         // actual model used (provider may differ from requested)

    public LlmResponse() {}

    public static LlmResponse ok(String rawText, String model, int in, int out) {
        LlmResponse r = new LlmResponse();
        r.success      = true;
        r.rawText      = rawText;
        r.model        = model;
        r.inputTokens  = in;
        r.outputTokens = out;
        return r;
    }

    public static LlmResponse error(String message, int statusCode) {
        LlmResponse r = new LlmResponse();
        r.success      = false;
        r.errorMessage = message;
        r.statusCode   = statusCode;
        return r;
    }

    public boolean isSuccess()      { return success; }
    public String getRawText()      { return rawText; }
    public String getErrorMessage() { return errorMessage; }
    public int getStatusCode()      { return statusCode; }
    public int getInputTokens()     { return inputTokens; }
    public int getOutputTokens()    { return outputTokens; }
    public String getModel()        { return model; }
}
