package io.projectdesk.backend.project;

import io.projectdesk.backend.auth.AuthService;
import io.projectdesk.backend.auth.EmailVerificationService;
import io.projectdesk.backend.exception.InvalidStateException;
import io.projectdesk.backend.sponsorship.SponsorshipService;
import io.projectdesk.backend.user.User;
import io.projectdesk.backend.user.UserRepository;
import io.projectdesk.backend.user.UserRole;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns member email lists into accounts and puts them under the project supervisor's
 * sponsorship. Unknown emails get invited accounts. Must run inside the caller's transaction: the
 * sponsor row stays locked from the capacity check until the sponsorships are written.
 */
@Service
public class ProjectMembershipService {

  private static final Logger log = LoggerFactory.getLogger(ProjectMembershipService.class);

  private final UserRepository userRepository;
  private final SponsorshipService sponsorshipService;
  private final EmailVerificationService emailVerificationService;

  public ProjectMembershipService(
      UserRepository userRepository,
      SponsorshipService sponsorshipService,
      EmailVerificationService emailVerificationService) {
    this.userRepository = userRepository;
    this.sponsorshipService = sponsorshipService;
    this.emailVerificationService = emailVerificationService;
  }

  public record Member(User user, UserRole memberRole, boolean newAccount) {}

  public record Members(List<Member> students, List<Member> collaborators) {

    public Set<UUID> studentIds() {
      return ids(students);
    }

    public Set<UUID> collaboratorIds() {
      return ids(collaborators);
    }

    public List<Member> all() {
      var all = new ArrayList<Member>(students);
      all.addAll(collaborators);
      return all;
    }

    private static Set<UUID> ids(List<Member> members) {
      return members.stream()
          .map(member -> member.user().getId())
          .collect(Collectors.toCollection(LinkedHashSet::new));
    }
  }

  /**
   * Resolves the member lists and sponsors every student or collaborator not yet sponsored by
   * {@code sponsorId}. An email listed as both student and collaborator counts as a collaborator.
   *
   * @throws io.projectdesk.backend.exception.ResourceConflictException if a member is sponsored
   *     by another supervisor
   * @throws io.projectdesk.backend.exception.ForbiddenException if new sponsorships are needed and
   *     the sponsor cannot sponsor accounts
   * @throws io.projectdesk.backend.exception.SponsorLimitExceededException if the new sponsorships
   *     do not fit under the limit
   */
  public Members resolveAndSponsor(
      Collection<String> studentEmails, Collection<String> collaboratorEmails, UUID sponsorId) {
    var collaborators = normalize(collaboratorEmails);
    var students = normalize(studentEmails);
    students.removeAll(collaborators);

    var all = new LinkedHashSet<String>(students);
    all.addAll(collaborators);
    Map<String, User> existing =
        userRepository.findByEmailIn(all).stream()
            .collect(Collectors.toMap(User::getEmail, Function.identity()));

    var now = Instant.now();
    var studentMembers = resolve(students, UserRole.STUDENT, existing, now);
    var collaboratorMembers = resolve(collaborators, UserRole.COLLABORATOR, existing, now);
    var members = new Members(studentMembers, collaboratorMembers);

    sponsor(members, sponsorId, now);
    return members;
  }

  private void sponsor(Members members, UUID sponsorId, Instant now) {
    var sponsorable =
        members.all().stream()
            .map(Member::user)
            .filter(user -> user.getRole().isSponsorable())
            .toList();
    if (sponsorable.isEmpty()) {
      return;
    }

    var sponsor = sponsorshipService.lockSponsor(sponsorId);
    sponsorable.forEach(user -> sponsorshipService.requireNotSponsoredElsewhere(user, sponsorId));

    var toSponsor =
        sponsorable.stream()
            .filter(user -> !Objects.equals(sponsorId, user.getSponsorId()))
            .toList();
    if (!toSponsor.isEmpty()) {
      sponsorshipService.requireCanSponsor(sponsor);
      sponsorshipService.requireCapacity(sponsor, toSponsor.size());
      toSponsor.forEach(user -> user.approveSponsorship(sponsorId, now));
      log.info("Supervisor {} sponsored {} project members", sponsorId, toSponsor.size());
    }
  }

  private List<Member> resolve(
      Set<String> emails, UserRole role, Map<String, User> existing, Instant now) {
    var members = new ArrayList<Member>();
    for (String email : emails) {
      var user = existing.get(email);
      if (user == null) {
        user = userRepository.save(User.invited(defaultName(email), email, role, now));
        emailVerificationService.issueToken(user);
        log.info("Created invited {} account {}", role, user.getId());
        members.add(new Member(user, role, true));
        continue;
      }
      if (role == UserRole.COLLABORATOR && user.getRole() == UserRole.STUDENT) {
        user.changeRole(UserRole.COLLABORATOR, now);
      }
      members.add(new Member(user, role, false));
    }
    return members;
  }

  private static LinkedHashSet<String> normalize(Collection<String> emails) {
    var normalized = new LinkedHashSet<String>();
    if (emails == null) {
      return normalized;
    }
    for (String raw : emails) {
      String email = AuthService.normalizeEmail(raw);
      if (email.isEmpty()) {
        continue;
      }
      if (!AuthService.EMAIL_PATTERN.matcher(email).matches()) {
        throw new InvalidStateException("Invalid member", "Invalid email address: " + email);
      }
      normalized.add(email);
    }
    return normalized;
  }

  private static String defaultName(String email) {
    int at = email.indexOf('@');
    return at > 0 ? email.substring(0, at) : email;
  }
}
