package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Catalog entry handed to the reasoning provider.
 */
@Value
@Builder
@Jacksonized
public class ToolSpec {
    String name;
    String description;
    JsonNode parameters;
}
