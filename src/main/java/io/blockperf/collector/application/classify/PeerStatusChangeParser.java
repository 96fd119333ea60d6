package io.blockperf.collector.application.classify;

import io.blockperf.collector.domain.net.Endpoint;
import io.blockperf.collector.domain.peer.PeerState;
import io.blockperf.collector.domain.peer.PeerStateTransition;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code peerStatusChangeType} string of peer selection status-change events.
 *
 * <p>Accepted forms, where states are Cold, Warm, or Hot and IPv6 addresses are bracketed:</p>
 * <ul>
 *   <li>{@code ColdToWarm (Just 172.0.118.125:3001) 3.228.174.253:6000}</li>
 *   <li>{@code ColdToWarm 3.228.174.253:6000}</li>
 *   <li>{@code WarmToHot (ConnectionId {localAddress = [2a05::1]:3001, remoteAddress = [2600::2]:33525})}</li>
 * </ul>
 * <p>Any other text, an unknown state token, or a (from, to) pair outside {@link PeerStateTransition} yields an
 * empty result.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class PeerStatusChangeParser {
  private static final String STATE = "(Cold|Warm|Hot)";
  private static final String ENDPOINT = "(\\[[^\\]\\s]+\\]:\\d{1,5}|[^\\s:\\[\\]()]+:\\d{1,5})";

  private static final Pattern JUST_FORM =
      Pattern.compile("^" + STATE + "To" + STATE + " \\(Just " + ENDPOINT + "\\) " + ENDPOINT + "$");
  private static final Pattern BARE_FORM =
      Pattern.compile("^" + STATE + "To" + STATE + " " + ENDPOINT + "$");
  private static final Pattern CONNECTION_ID_FORM = Pattern.compile(
      "^" + STATE + "To" + STATE
          + " \\(ConnectionId \\{localAddress = " + ENDPOINT + ", remoteAddress = " + ENDPOINT + "\\}\\)$");

  /**
   * Parsed status change.
   *
   * @param transition validated transition row
   * @param local local endpoint, or {@code null} when the text carries none
   * @param remote remote endpoint
   */
  public record StatusChange(PeerStateTransition transition, Endpoint local, Endpoint remote) {
    public StatusChange {
      Objects.requireNonNull(transition, "transition");
      Objects.requireNonNull(remote, "remote");
    }

    public PeerState from() {
      return transition.from();
    }

    public PeerState to() {
      return transition.to();
    }
  }

  /**
   * Parses a status change string.
   *
   * @param text value of {@code peerStatusChangeType}; {@code null} yields empty
   * @return parsed change, or empty when the text matches none of the accepted forms
   */
  public Optional<StatusChange> parse(String text) {
    if (text == null) {
      return Optional.empty();
    }
    String trimmed = text.trim();
    try {
      Matcher just = JUST_FORM.matcher(trimmed);
      if (just.matches()) {
        return build(just.group(1), just.group(2), just.group(3), just.group(4));
      }
      Matcher bare = BARE_FORM.matcher(trimmed);
      if (bare.matches()) {
        return build(bare.group(1), bare.group(2), null, bare.group(3));
      }
      Matcher connection = CONNECTION_ID_FORM.matcher(trimmed);
      if (connection.matches()) {
        return build(connection.group(1), connection.group(2), connection.group(3), connection.group(4));
      }
    } catch (IllegalArgumentException ex) {
      // port out of range or malformed bracket literal
      return Optional.empty();
    }
    return Optional.empty();
  }

  private static Optional<StatusChange> build(String from, String to, String local, String remote) {
    Optional<PeerState> fromState = PeerState.fromLogToken(from);
    Optional<PeerState> toState = PeerState.fromLogToken(to);
    if (fromState.isEmpty() || toState.isEmpty()) {
      return Optional.empty();
    }
    Optional<PeerStateTransition> transition = PeerStateTransition.between(fromState.get(), toState.get());
    if (transition.isEmpty()) {
      return Optional.empty();
    }
    Endpoint localEndpoint = local == null ? null : Endpoint.parse(local);
    return Optional.of(new StatusChange(transition.get(), localEndpoint, Endpoint.parse(remote)));
  }
}
