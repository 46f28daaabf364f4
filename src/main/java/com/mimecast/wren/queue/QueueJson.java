package com.mimecast.wren.queue;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Shared Gson instance for queue wire formats.
 * <p>Fields are snake_case and nulls are written.
 */
public final class QueueJson {

    /**
     * Gson instance.
     */
    public static final Gson GSON = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    /**
     * Private constructor.
     */
    private QueueJson() {
        throw new IllegalStateException("Static class");
    }
}
