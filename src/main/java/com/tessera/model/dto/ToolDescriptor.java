package com.tessera.model.dto;

import com.tessera.model.FallbackConfig;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ToolDescriptor {
    String name;
    String description;
    String cacheLayer;
    boolean available;
    FallbackConfig fallbackConfig;
}
