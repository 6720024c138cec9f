package com.enterprise.taskengine.serialization;

import java.util.List;

/**
 * Implemented by exceptions whose state is more than their message. The
 * values returned must be in the order of a public constructor of the
 * exception, so that {@link ExceptionCodec} can rebuild it on the other side.
 */
public interface ConstructorArguments {
    
    List<Object> getConstructorArguments();
}
