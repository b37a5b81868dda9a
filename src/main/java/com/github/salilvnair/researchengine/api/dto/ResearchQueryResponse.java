package com.github.salilvnair.researchengine.api.dto;

import com.github.salilvnair.researchengine.engine.model.ResponseMetadata;
import lombok.Data;

import java.util.List;

@Data
public class ResearchQueryResponse {

    private String conversationId;
    private String message;
    private ResponseMetadata metadata;
    private List<String> suggestions;
}
