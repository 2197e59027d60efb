/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.mqworker.server.handler;

import com.mqworker.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Instantiates {@link MessageHandler} implementations by class name.
 */
public final class HandlerFactory {

    private static final Logger log = LoggerFactory.getLogger(HandlerFactory.class);

    private HandlerFactory() {}

    public static MessageHandler create(String handlerClass, Map<String, Object> config) {
        if (handlerClass == null || handlerClass.isBlank()) {
            throw new ConfigurationException("handler_class is required");
        }
        Class<?> clazz;
        try {
            clazz = Class.forName(handlerClass);
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("Handler class not found: " + handlerClass, e);
        }
        if (!MessageHandler.class.isAssignableFrom(clazz)) {
            throw new ConfigurationException(handlerClass + " does not implement " + MessageHandler.class.getName());
        }
        MessageHandler handler;
        try {
            handler = (MessageHandler) clazz.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException("Cannot instantiate handler " + handlerClass, e);
        }
        handler.construct(config != null ? config : Map.of());
        log.debug("Handler {} constructed", clazz.getSimpleName());
        return handler;
    }
}
