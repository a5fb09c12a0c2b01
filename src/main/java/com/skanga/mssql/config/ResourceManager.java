package com.skanga.mssql.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Properties;

/**
 * Loads user-facing message templates from {@code messages.properties} on the classpath.
 */
public final class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final String MESSAGES_RESOURCE = "/messages.properties";
    private static final Properties messages = loadMessages();

    private ResourceManager() {
    }

    /**
     * Formats the message stored under {@code key} with {@link MessageFormat}.
     * Unknown keys come back as the key itself followed by the arguments.
     */
    public static String getErrorMessage(String key, Object... args) {
        String messageTemplate = messages.getProperty(key);
        if (messageTemplate == null) {
            logger.warn("Missing message key: {}", key);
            StringBuilder fallbackMessage = new StringBuilder(key);
            for (Object arg : args) {
                fallbackMessage.append(' ').append(arg);
            }
            return fallbackMessage.toString();
        }
        return args.length == 0 ? messageTemplate : MessageFormat.format(messageTemplate, args);
    }

    private static Properties loadMessages() {
        Properties loadedMessages = new Properties();
        try (InputStream inputStream = ResourceManager.class.getResourceAsStream(MESSAGES_RESOURCE)) {
            if (inputStream == null) {
                logger.error("Message resource {} not found on classpath", MESSAGES_RESOURCE);
                return loadedMessages;
            }
            try (Reader messageReader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
                loadedMessages.load(messageReader);
            }
        } catch (IOException e) {
            logger.error("Failed to load message resource {}: {}", MESSAGES_RESOURCE, e.getMessage(), e);
        }
        return loadedMessages;
    }
}
