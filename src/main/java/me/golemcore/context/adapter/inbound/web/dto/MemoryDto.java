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
public class MemoryDto {
    private String id;
    private String sessionId;
    private String summary;
    private List<String> keyTopics;
    private List<String> decisions;
    private String messageStart;
    private String messageEnd;
    private int messageCount;
    private String createdAt;
    private String lastAccessedAt;
    private int accessCount;
    private String tier;
    private String tierUpdatedAt;
}
