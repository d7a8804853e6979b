package com.tessera.tenancy.api.dto;

import com.tessera.tenancy.domain.Membership;

public record MemberResponse(String userId, String role) {

    public static MemberResponse from(Membership membership) {
        return new MemberResponse(membership.userId(), membership.role().claimName());
    }
}
