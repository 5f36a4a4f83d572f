package com.flagship.contribution_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class CreatedResponse {

    @JsonProperty("id")
    long id;
}
