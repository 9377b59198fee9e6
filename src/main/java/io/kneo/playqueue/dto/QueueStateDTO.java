package io.kneo.playqueue.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.kneo.playqueue.model.cnst.PlayerState;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Setter
@Getter
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueueStateDTO {
    private String partition;
    private long version;
    private PlayerState state = PlayerState.STOP;
    private Integer currentPosition;
    private boolean random;
    private boolean repeat;
    private boolean single;
    private boolean consume;
    private List<QueueStateEntryDTO> entries = new ArrayList<>();
}
