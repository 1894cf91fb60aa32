package tech.simplekanban.platform.authorization;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.apikey.ApiKeyRepository;
import tech.simplekanban.platform.board.Board;
import tech.simplekanban.platform.board.BoardRepository;
import tech.simplekanban.platform.group.GroupMembership;
import tech.simplekanban.platform.group.GroupMembershipRepository;
import tech.simplekanban.platform.group.GroupRepository;
import tech.simplekanban.platform.identity.Principal;
import tech.simplekanban.platform.security.SecurityRejectionException;

import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a principal may perform an action on a resource.
 *
 * <p>Precedence, first match wins:
 * <ol>
 *   <li>Administrator: every capability</li>
 *   <li>Personal resource owned by the principal's user: owner capabilities</li>
 *   <li>Group-owned resource: capabilities of the user's role in that group, none if not a member</li>
 *   <li>Anything else: none</li>
 * </ol>
 * For API key principals the result is then intersected with the key's scope capabilities,
 * so a key can never do more than its scopes allow, whatever its owner's role.
 *
 * <p>Decisions are a function of the principal and the database state read during the call.
 */
@ApplicationScoped
public class AuthorizationEngine {

    private static final Logger LOG = Logger.getLogger(AuthorizationEngine.class);

    @Inject
    BoardRepository boardRepository;

    @Inject
    GroupRepository groupRepository;

    @Inject
    GroupMembershipRepository membershipRepository;

    @Inject
    ApiKeyRepository apiKeyRepository;

    public boolean authorize(Principal principal, ResourceRef resource, Capability action) {
        boolean allowed = effectiveCapabilities(principal, resource).contains(action);
        LOG.debugf("Authorization %s: user=%s source=%s resource=%s action=%s",
            allowed ? "granted" : "denied", principal.userId(), principal.source(), resource, action);
        return allowed;
    }

    /**
     * Like {@link #authorize} but throws a forbidden rejection naming the resource.
     */
    public void require(Principal principal, ResourceRef resource, Capability action) {
        if (!authorize(principal, resource, action)) {
            throw SecurityRejectionException.forbidden(resource.displayName());
        }
    }

    public Set<Capability> effectiveCapabilities(Principal principal, ResourceRef resource) {
        Set<Capability> granted = roleCapabilities(principal, resource);
        if (principal.isApiKey()) {
            return Capabilities.intersect(granted, Capabilities.forScopes(principal.scopes()));
        }
        return granted;
    }

    private Set<Capability> roleCapabilities(Principal principal, ResourceRef resource) {
        if (principal.admin()) {
            return Capabilities.ALL;
        }

        return switch (resource.type()) {
            case SYSTEM -> Capabilities.AUTHENTICATED;
            case USER -> principal.userId().equals(resource.id()) ? Capabilities.OWNER : Capabilities.NONE;
            case API_KEY -> apiKeyRepository.findKeyById(resource.id())
                .map(key -> key.userId)
                .filter(principal.userId()::equals)
                .map(owner -> Capabilities.OWNER)
                .orElse(Capabilities.NONE);
            case GROUP -> groupRepository.findGroupById(resource.id()).isPresent()
                ? Capabilities.forGroupRole(roleIn(resource.id(), principal.userId()).map(m -> m.role).orElse(null))
                : Capabilities.NONE;
            case BOARD -> boardCapabilities(principal, resource.id());
        };
    }

    private Set<Capability> boardCapabilities(Principal principal, String boardId) {
        Optional<Board> found = boardRepository.findBoardById(boardId);
        if (found.isEmpty()) {
            return Capabilities.NONE;
        }
        Board board = found.get();
        if (board.isGroupOwned()) {
            return Capabilities.forBoardRole(roleIn(board.groupId, principal.userId()).map(m -> m.role).orElse(null));
        }
        if (board.isPersonal() && principal.userId().equals(board.ownerId)) {
            return Capabilities.OWNER;
        }
        // Orphaned boards and other users' personal boards
        return Capabilities.NONE;
    }

    private Optional<GroupMembership> roleIn(String groupId, String userId) {
        return membershipRepository.findMembership(groupId, userId);
    }
}
