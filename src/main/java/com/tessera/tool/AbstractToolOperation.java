package com.tessera.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.service.cache.CacheLayer;
import com.tessera.service.error.ErrorCategory;
import com.tessera.service.error.ToolException;
import com.tessera.service.error.ValidationException;
import com.tessera.service.validation.InputValidator;
import com.tessera.service.validation.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

/**
 * Abstract base class for tool operations with common functionality.
 */
@Slf4j
public abstract class AbstractToolOperation<I, O> implements ToolOperation<I, O> {

    private static final int KEY_HASH_LENGTH = 16;

    protected final ObjectMapper objectMapper;

    private final String name;
    private final String description;
    private final CacheLayer cacheLayer;
    private final InputValidator<I> inputValidator;
    private final Class<O> outputType;

    protected AbstractToolOperation(String name,
                                    String description,
                                    CacheLayer cacheLayer,
                                    InputValidator<I> inputValidator,
                                    Class<O> outputType,
                                    ObjectMapper objectMapper) {
        this.name = name;
        this.description = description;
        this.cacheLayer = cacheLayer;
        this.inputValidator = inputValidator;
        this.outputType = outputType;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getDescription() {
        return description;
    }

    @Override
    public CacheLayer getCacheLayer() {
        return cacheLayer;
    }

    @Override
    public Class<O> getOutputType() {
        return outputType;
    }

    @Override
    public I validateInput(Object rawParameters) {
        ValidationResult<I> result = inputValidator.validate(rawParameters);
        if (!result.isOk()) {
            throw new ValidationException(name, result.getIssues());
        }
        return result.getValue();
    }

    /**
     * Default transformation: the raw result already is the output, or converts to it.
     */
    @Override
    public O transformOutput(Object rawResult) {
        if (outputType.isInstance(rawResult)) {
            return outputType.cast(rawResult);
        }
        try {
            return objectMapper.convertValue(rawResult, outputType);
        } catch (IllegalArgumentException e) {
            throw new ToolException("Unexpected result type from " + name + ": "
                    + (rawResult == null ? "null" : rawResult.getClass().getName()), ErrorCategory.EXECUTION, e);
        }
    }

    /**
     * Build a key of the form {@code <prefix>:<first 16 hex chars of sha256(json(material))>}.
     */
    protected String hashedKey(String prefix, Object keyMaterial) {
        try {
            String hash = DigestUtils.sha256Hex(objectMapper.writeValueAsBytes(keyMaterial));
            return prefix + ":" + hash.substring(0, KEY_HASH_LENGTH);
        } catch (JsonProcessingException e) {
            throw new ToolException("Failed to compute cache key for " + name, ErrorCategory.EXECUTION, e);
        }
    }
}
