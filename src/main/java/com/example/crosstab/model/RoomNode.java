package com.example.crosstab.model;

import com.example.crosstab.util.Constants.RoomType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class RoomNode {
    String id;
    RoomType type;
    String parentId;
    @Singular("metadataEntry")
    Map<String, String> metadata;
    Instant createdAt;
}
