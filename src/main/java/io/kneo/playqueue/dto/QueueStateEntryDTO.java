package io.kneo.playqueue.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

@Setter
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueueStateEntryDTO {
    private String uri;
    private Map<String, String> tags = new LinkedHashMap<>();
    private int priority;
    private long startMs;
    private long endMs;
}
