package io.blockperf.collector.application.classify;

import static org.junit.jupiter.api.Assertions.*;

import io.blockperf.collector.domain.net.Endpoint;
import io.blockperf.collector.domain.peer.PeerState;
import io.blockperf.collector.domain.peer.PeerStateTransition;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PeerStatusChangeParserTest {
  private final PeerStatusChangeParser parser = new PeerStatusChangeParser();

  @Test
  void parsesJustForm() {
    PeerStatusChangeParser.StatusChange change =
        parser.parse("WarmToHot (Just 10.0.0.5:3001) 3.228.174.253:6000").orElseThrow();

    assertEquals(PeerStateTransition.WARM_TO_HOT, change.transition());
    assertEquals(PeerState.WARM, change.from());
    assertEquals(PeerState.HOT, change.to());
    assertEquals(new Endpoint("10.0.0.5", 3001), change.local());
    assertEquals(new Endpoint("3.228.174.253", 6000), change.remote());
  }

  @Test
  void parsesBareFormWithoutLocal() {
    PeerStatusChangeParser.StatusChange change = parser.parse("  HotToWarm 1.2.3.4:3001 ").orElseThrow();

    assertEquals(PeerStateTransition.HOT_TO_WARM, change.transition());
    assertNull(change.local());
    assertEquals(new Endpoint("1.2.3.4", 3001), change.remote());
  }

  @Test
  void parsesConnectionIdFormWithIpv6() {
    PeerStatusChangeParser.StatusChange change = parser.parse(
        "WarmToCold (ConnectionId {localAddress = [::1]:3001, remoteAddress = [2001:db8::7]:3002})")
        .orElseThrow();

    assertEquals(PeerStateTransition.WARM_TO_COLD, change.transition());
    assertEquals(new Endpoint("::1", 3001), change.local());
    assertEquals(new Endpoint("2001:db8::7", 3002), change.remote());
  }

  @Test
  void rejectsUnknownTransitionsAndBadEndpoints() {
    assertEquals(Optional.empty(), parser.parse(null));
    assertEquals(Optional.empty(), parser.parse("ColdToHot 1.2.3.4:3001"));
    assertEquals(Optional.empty(), parser.parse("ColdToWarm 1.2.3.4:99999"));
    assertEquals(Optional.empty(), parser.parse("ColdToWarm 1.2.3.4"));
    assertEquals(Optional.empty(), parser.parse("PromotedToWarm 1.2.3.4:3001"));
  }
}
