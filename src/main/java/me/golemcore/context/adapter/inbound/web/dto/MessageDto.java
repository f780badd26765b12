package me.golemcore.context.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageDto {
    private String id;
    private String role;
    private String content;
    private String timestamp;
    private Integer tokenCount;
    private String toolCallId;
    private String toolName;
    private String compressionState;
    private String replacedBy;
    private boolean summary;
    private String condenseId;
    private boolean pruned;
    private String checkpointId;
}
