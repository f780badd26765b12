package me.golemcore.context.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppendMessageRequest {
    private String id;
    private String role;
    private String content;
    private String toolCallId;
    private String toolName;
    private Integer tokenCount;
}
