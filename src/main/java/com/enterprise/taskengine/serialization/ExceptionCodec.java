package com.enterprise.taskengine.serialization;

import com.enterprise.taskengine.exception.MaxRetriesExceededException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves task failures across process boundaries.
 * <p>
 * An exception is encoded as its class name, message and constructor
 * arguments. Arguments that Jackson cannot write are dropped. Decoding looks
 * for a public constructor taking the surviving arguments; when there is
 * none the failure comes back as an {@link UnserializableExceptionWrapper}.
 */
public class ExceptionCodec {
    
    private static final Logger logger = LoggerFactory.getLogger(ExceptionCodec.class);
    
    private final ObjectMapper objectMapper;
    
    public ExceptionCodec() {
        this(new ObjectMapper().registerModule(new JavaTimeModule()));
    }
    
    public ExceptionCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    /**
     * Describe an exception in portable form
     */
    public ExceptionInfo encode(Throwable error) {
        if (error instanceof UnserializableExceptionWrapper) {
            UnserializableExceptionWrapper wrapper = (UnserializableExceptionWrapper) error;
            return new ExceptionInfo(wrapper.getExcClassName(), wrapper.getExcMessage(), wrapper.getExcArgs());
        }
        
        List<Object> candidates = constructorArguments(error);
        List<Object> portable = new ArrayList<>(candidates.size());
        for (Object argument : candidates) {
            if (isSerializable(argument)) {
                portable.add(argument);
            } else {
                logger.debug("Dropping unserializable argument of type {} from {}",
                            argument.getClass().getName(), error.getClass().getName());
            }
        }
        
        return new ExceptionInfo(error.getClass().getName(), error.getMessage(), portable);
    }
    
    /**
     * Rebuild an exception from its portable form. Never fails: anything that
     * cannot be instantiated comes back wrapped.
     */
    public Throwable decode(ExceptionInfo info) {
        List<Object> arguments = info.getArguments();
        try {
            Class<?> type = Class.forName(info.getType(), false, ExceptionCodec.class.getClassLoader());
            if (Throwable.class.isAssignableFrom(type)) {
                // exact parameter matches first, Jackson conversions second
                for (boolean strict : new boolean[] {true, false}) {
                    for (Constructor<?> constructor : type.getConstructors()) {
                        if (constructor.getParameterCount() != arguments.size()) {
                            continue;
                        }
                        Object[] converted = convert(constructor.getParameterTypes(), arguments, strict);
                        if (converted != null) {
                            return (Throwable) constructor.newInstance(converted);
                        }
                    }
                }
            }
        } catch (ClassNotFoundException e) {
            logger.debug("Exception class {} is not available locally", info.getType());
        } catch (ReflectiveOperationException | LinkageError e) {
            logger.debug("Could not instantiate {}: {}", info.getType(), e.getMessage());
        }
        return new UnserializableExceptionWrapper(info.getType(), info.getMessage(), arguments);
    }
    
    /**
     * Serialize and deserialize an exception the way a result backend would
     */
    public Throwable roundTrip(Throwable error) {
        try {
            String json = objectMapper.writeValueAsString(encode(error));
            return decode(objectMapper.readValue(json, ExceptionInfo.class));
        } catch (JsonProcessingException e) {
            logger.warn("Failed to serialize exception {}: {}", error.getClass().getName(), e.getMessage());
            return new UnserializableExceptionWrapper(error.getClass().getName(), error.getMessage(), List.of());
        }
    }
    
    /**
     * The form of an exception that is safe to hand to a remote caller. An
     * exception that survives the round trip as the same class with all of
     * its arguments is returned untouched; {@link MaxRetriesExceededException}
     * keeps its own type and only its cause is made portable.
     */
    public Throwable portable(Throwable error) {
        if (error == null || error instanceof UnserializableExceptionWrapper) {
            return error;
        }
        if (error instanceof MaxRetriesExceededException) {
            Throwable cause = error.getCause();
            if (cause == null) {
                return error;
            }
            Throwable portableCause = portable(cause);
            return portableCause == cause ? error : ((MaxRetriesExceededException) error).withCause(portableCause);
        }
        ExceptionInfo info = encode(error);
        if (info.getArguments().size() < constructorArguments(error).size()) {
            // a shorter constructor could still rebuild the class without the dropped arguments
            return new UnserializableExceptionWrapper(info.getType(), info.getMessage(), info.getArguments());
        }
        Throwable restored = roundTrip(error);
        return restored.getClass() == error.getClass() ? error : restored;
    }
    
    private static List<Object> constructorArguments(Throwable error) {
        if (error instanceof ConstructorArguments) {
            return ((ConstructorArguments) error).getConstructorArguments();
        }
        if (error.getMessage() != null) {
            return List.of(error.getMessage());
        }
        return List.of();
    }
    
    private boolean isSerializable(Object value) {
        try {
            objectMapper.writeValueAsString(value);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }
    
    private Object[] convert(Class<?>[] parameterTypes, List<Object> arguments, boolean strict) {
        Object[] converted = new Object[arguments.size()];
        for (int i = 0; i < parameterTypes.length; i++) {
            Object argument = arguments.get(i);
            if (argument == null) {
                if (parameterTypes[i].isPrimitive()) {
                    return null;
                }
                continue;
            }
            if (strict) {
                if (!boxed(parameterTypes[i]).isInstance(argument)) {
                    return null;
                }
                converted[i] = argument;
                continue;
            }
            if (Throwable.class.isAssignableFrom(parameterTypes[i])) {
                return null;
            }
            try {
                converted[i] = objectMapper.convertValue(argument, parameterTypes[i]);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        return converted;
    }
    
    private static Class<?> boxed(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        if (type == int.class) return Integer.class;
        if (type == long.class) return Long.class;
        if (type == boolean.class) return Boolean.class;
        if (type == double.class) return Double.class;
        if (type == float.class) return Float.class;
        if (type == short.class) return Short.class;
        if (type == byte.class) return Byte.class;
        if (type == char.class) return Character.class;
        return Void.class;
    }
}
