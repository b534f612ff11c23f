package com.demo.groupchat.service;

import com.demo.groupchat.domain.ChatParticipant;
import com.demo.groupchat.domain.ChatSession;
import com.demo.groupchat.domain.ParticipantRole;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Permission rules for chat sessions, evaluated over a loaded participant row (or its absence).
 * <p>
 * Every lifecycle operation and every posted message goes through these checks, so the role
 * model lives in one place:
 * <ul>
 *   <li>owner: everything, including owner-level role changes</li>
 *   <li>admin: invite, remove and re-role non-owners</li>
 *   <li>member: view and post</li>
 *   <li>viewer: view only</li>
 * </ul>
 * An inactive participant row grants nothing.
 */
public final class SessionAccessPolicy {

    private static final Set<ParticipantRole> POSTING_ROLES =
        EnumSet.of(ParticipantRole.OWNER, ParticipantRole.ADMIN, ParticipantRole.MEMBER);

    private static final Set<ParticipantRole> ADMIN_ROLES =
        EnumSet.of(ParticipantRole.OWNER, ParticipantRole.ADMIN);

    private SessionAccessPolicy() {
    }

    public static boolean isOpen(Optional<ChatSession> session) {
        return session.map(ChatSession::isActive).orElse(false);
    }

    public static boolean canView(Optional<ChatParticipant> participant) {
        return participant.map(ChatParticipant::isActive).orElse(false);
    }

    public static boolean canPost(Optional<ChatParticipant> participant) {
        return hasActiveRole(participant, POSTING_ROLES);
    }

    public static boolean canAdminister(Optional<ChatParticipant> participant) {
        return hasActiveRole(participant, ADMIN_ROLES);
    }

    public static boolean isOwner(Optional<ChatParticipant> participant) {
        return hasActiveRole(participant, EnumSet.of(ParticipantRole.OWNER));
    }

    /**
     * Owner-level changes (touching the owner, or granting ownership) need an owner as actor.
     * The owner row itself is never demoted; ownership only moves through a grant by the owner.
     */
    public static boolean canChangeRole(Optional<ChatParticipant> actor,
                                        Optional<ChatParticipant> target,
                                        ParticipantRole newRole) {
        if (newRole == null || !canAdminister(actor) || !canView(target)) {
            return false;
        }
        if (isOwner(target)) {
            return false;
        }
        if (newRole == ParticipantRole.OWNER) {
            return isOwner(actor);
        }
        return true;
    }

    public static boolean canRemove(Optional<ChatParticipant> actor, Optional<ChatParticipant> target) {
        return canAdminister(actor) && canView(target) && !isOwner(target);
    }

    public static boolean canLeave(Optional<ChatParticipant> participant) {
        return canView(participant) && !isOwner(participant);
    }

    private static boolean hasActiveRole(Optional<ChatParticipant> participant, Set<ParticipantRole> roles) {
        return participant
            .filter(ChatParticipant::isActive)
            .map(p -> roles.contains(p.getRole()))
            .orElse(false);
    }
}
