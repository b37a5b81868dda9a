package com.github.salilvnair.researchengine.api.dto;

import lombok.Data;

@Data
public class ResearchQueryRequest {

    private String message;
    private String userId;
    private String conversationId;
}
