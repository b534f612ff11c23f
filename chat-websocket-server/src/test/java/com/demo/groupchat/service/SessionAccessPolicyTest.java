package com.demo.groupchat.service;

import com.demo.groupchat.domain.ChatParticipant;
import com.demo.groupchat.domain.ChatSession;
import com.demo.groupchat.domain.ParticipantRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.demo.groupchat.domain.ParticipantRole.*;
import static org.junit.jupiter.api.Assertions.*;

public class SessionAccessPolicyTest {

    private static Optional<ChatParticipant> active(ParticipantRole role) {
        return Optional.of(ChatParticipant.builder().sessionId(1L).userId(1L).role(role).active(true).build());
    }

    private static Optional<ChatParticipant> inactive(ParticipantRole role) {
        return Optional.of(ChatParticipant.builder().sessionId(1L).userId(1L).role(role).active(false).build());
    }

    @Test
    public void viewAndPostFollowRoles() {
        for (ParticipantRole role : ParticipantRole.values()) {
            assertTrue(SessionAccessPolicy.canView(active(role)), role.name());
        }
        assertTrue(SessionAccessPolicy.canPost(active(OWNER)));
        assertTrue(SessionAccessPolicy.canPost(active(ADMIN)));
        assertTrue(SessionAccessPolicy.canPost(active(MEMBER)));
        assertFalse(SessionAccessPolicy.canPost(active(VIEWER)));
    }

    @Test
    public void absentOrInactiveParticipantGetsNothing() {
        for (Optional<ChatParticipant> p : List.of(Optional.<ChatParticipant>empty(), inactive(OWNER))) {
            assertFalse(SessionAccessPolicy.canView(p));
            assertFalse(SessionAccessPolicy.canPost(p));
            assertFalse(SessionAccessPolicy.canAdminister(p));
            assertFalse(SessionAccessPolicy.isOwner(p));
            assertFalse(SessionAccessPolicy.canLeave(p));
        }
    }

    @Test
    public void administrationIsOwnerOrAdmin() {
        assertTrue(SessionAccessPolicy.canAdminister(active(OWNER)));
        assertTrue(SessionAccessPolicy.canAdminister(active(ADMIN)));
        assertFalse(SessionAccessPolicy.canAdminister(active(MEMBER)));
        assertFalse(SessionAccessPolicy.canAdminister(active(VIEWER)));
    }

    @Test
    public void ownerIsNeverRemovedDemotedOrLeaving() {
        assertFalse(SessionAccessPolicy.canRemove(active(ADMIN), active(OWNER)));
        assertFalse(SessionAccessPolicy.canRemove(active(OWNER), active(OWNER)));
        assertFalse(SessionAccessPolicy.canChangeRole(active(OWNER), active(OWNER), ADMIN));
        assertFalse(SessionAccessPolicy.canChangeRole(active(ADMIN), active(OWNER), MEMBER));
        assertFalse(SessionAccessPolicy.canLeave(active(OWNER)));
    }

    @Test
    public void onlyOwnerGrantsOwnership() {
        assertTrue(SessionAccessPolicy.canChangeRole(active(OWNER), active(MEMBER), OWNER));
        assertFalse(SessionAccessPolicy.canChangeRole(active(ADMIN), active(MEMBER), OWNER));
    }

    @Test
    public void adminsReRoleAndRemoveNonOwners() {
        assertTrue(SessionAccessPolicy.canChangeRole(active(ADMIN), active(MEMBER), VIEWER));
        assertTrue(SessionAccessPolicy.canChangeRole(active(ADMIN), active(ADMIN), MEMBER));
        assertTrue(SessionAccessPolicy.canRemove(active(ADMIN), active(MEMBER)));
        assertFalse(SessionAccessPolicy.canRemove(active(MEMBER), active(VIEWER)));
        assertFalse(SessionAccessPolicy.canChangeRole(active(MEMBER), active(VIEWER), MEMBER));
        assertFalse(SessionAccessPolicy.canChangeRole(active(ADMIN), inactive(MEMBER), VIEWER));
        assertFalse(SessionAccessPolicy.canChangeRole(active(ADMIN), active(MEMBER), null));
    }

    @Test
    public void sessionMustBeActive() {
        assertTrue(SessionAccessPolicy.isOpen(Optional.of(ChatSession.builder().active(true).build())));
        assertFalse(SessionAccessPolicy.isOpen(Optional.of(ChatSession.builder().active(false).build())));
        assertFalse(SessionAccessPolicy.isOpen(Optional.empty()));
    }
}
