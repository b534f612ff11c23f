package com.demo.groupchat.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InviteRequest {

    @JsonProperty("user_id")
    private Long userId;

    @Builder.Default
    private ParticipantRole role = ParticipantRole.MEMBER;
}
