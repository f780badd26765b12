package me.golemcore.context.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointDto {
    private String id;
    private String sessionId;
    private String name;
    private int messageCount;
    private long tokenCount;
    private String summary;
    private String createdAt;
    private List<MessageDto> messages;
}
