package io.blockperf.collector.infrastructure.os;

import io.blockperf.collector.application.port.OsConnectionSnapshot;
import io.blockperf.collector.domain.net.Endpoint;
import io.blockperf.collector.domain.net.IpAddresses;
import io.blockperf.collector.domain.peer.OsConnection;
import io.blockperf.collector.domain.peer.PeerDirection;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Linux {@link OsConnectionSnapshot} reading {@code /proc/net/tcp} and {@code /proc/net/tcp6}.
 * <p><strong>Selection:</strong> Only ESTABLISHED sockets are returned. With a node PID, sockets are kept when their
 * inode appears under {@code /proc/<pid>/fd}; without one, only sockets whose local port is the node port are kept.
 * A socket whose local port is the node port is {@link PeerDirection#INBOUND}, any other is
 * {@link PeerDirection#OUTBOUND}.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; safe for the reconcile timer thread.</p>
 *
 * @since 0.1.0
 */
public final class ProcNetTcpConnectionSnapshot implements OsConnectionSnapshot {
  private static final Logger log = LoggerFactory.getLogger(ProcNetTcpConnectionSnapshot.class);

  private static final String STATE_ESTABLISHED = "01";
  private static final Pattern SOCKET_LINK = Pattern.compile("socket:\\[(\\d+)]");

  private final Path procRoot;
  private final int nodePort;
  private final OptionalLong nodePid;

  /**
   * Creates a snapshot reader over the real {@code /proc}.
   *
   * @param nodePort node listening port
   * @param nodePid node process id, if known
   */
  public ProcNetTcpConnectionSnapshot(int nodePort, OptionalLong nodePid) {
    this(Path.of("/proc"), nodePort, nodePid);
  }

  /**
   * Creates a snapshot reader over an alternate proc root.
   *
   * @param procRoot directory laid out like {@code /proc}
   * @param nodePort node listening port
   * @param nodePid node process id, if known
   */
  public ProcNetTcpConnectionSnapshot(Path procRoot, int nodePort, OptionalLong nodePid) {
    this.procRoot = Objects.requireNonNull(procRoot, "procRoot");
    this.nodePid = Objects.requireNonNull(nodePid, "nodePid");
    if (nodePort <= 0 || nodePort > 65_535) {
      throw new IllegalArgumentException("nodePort must be between 1 and 65535");
    }
    this.nodePort = nodePort;
  }

  @Override
  public Set<OsConnection> establishedConnections() throws IOException {
    Set<Long> inodes = nodePid.isPresent() ? socketInodes(nodePid.getAsLong()) : null;
    Set<OsConnection> connections = new LinkedHashSet<>();
    boolean anyTable = false;
    for (String table : List.of("tcp", "tcp6")) {
      Path path = procRoot.resolve("net").resolve(table);
      List<String> lines;
      try {
        lines = Files.readAllLines(path, StandardCharsets.US_ASCII);
      } catch (NoSuchFileException ex) {
        log.debug("{} not present; skipping", path);
        continue;
      }
      anyTable = true;
      for (int i = 1; i < lines.size(); i++) {
        parseLine(lines.get(i), inodes, path, connections);
      }
    }
    if (!anyTable) {
      throw new NoSuchFileException(procRoot.resolve("net").toString(), null, "no tcp tables found");
    }
    return connections;
  }

  private void parseLine(String line, Set<Long> inodes, Path path, Set<OsConnection> out) {
    String[] columns = line.trim().split("\\s+");
    if (columns.length < 10) {
      return;
    }
    if (!STATE_ESTABLISHED.equals(columns[3])) {
      return;
    }
    try {
      Endpoint local = decodeEndpoint(columns[1]);
      Endpoint remote = decodeEndpoint(columns[2]);
      if (inodes != null) {
        if (!inodes.contains(Long.parseLong(columns[9]))) {
          return;
        }
      } else if (local.port() != nodePort) {
        return;
      }
      PeerDirection direction = local.port() == nodePort ? PeerDirection.INBOUND : PeerDirection.OUTBOUND;
      out.add(new OsConnection(local, remote, direction));
    } catch (IllegalArgumentException ex) {
      log.debug("Ignoring unparseable line in {}: {}", path, ex.getMessage());
    }
  }

  private Set<Long> socketInodes(long pid) throws IOException {
    Set<Long> inodes = new HashSet<>();
    Path fdDir = procRoot.resolve(Long.toString(pid)).resolve("fd");
    try (DirectoryStream<Path> fds = Files.newDirectoryStream(fdDir)) {
      for (Path fd : fds) {
        String target;
        try {
          target = Files.readSymbolicLink(fd).toString();
        } catch (NoSuchFileException closed) {
          // Descriptor closed while listing.
          continue;
        }
        Matcher matcher = SOCKET_LINK.matcher(target);
        if (matcher.matches()) {
          inodes.add(Long.parseLong(matcher.group(1)));
        }
      }
    }
    return inodes;
  }

  /**
   * Decodes {@code HEXADDR:HEXPORT} as written by the kernel: IPv4 as one little-endian word, IPv6 as four
   * little-endian words. IPv4-mapped IPv6 addresses are reported as IPv4.
   */
  static Endpoint decodeEndpoint(String column) {
    int colon = column.indexOf(':');
    if (colon < 0) {
      throw new IllegalArgumentException("missing port in " + column);
    }
    String hexAddress = column.substring(0, colon);
    int port = Integer.parseInt(column.substring(colon + 1), 16);
    byte[] bytes;
    if (hexAddress.length() == 8) {
      bytes = littleEndianWords(hexAddress, 1);
    } else if (hexAddress.length() == 32) {
      bytes = littleEndianWords(hexAddress, 4);
    } else {
      throw new IllegalArgumentException("unexpected address length in " + column);
    }
    return new Endpoint(IpAddresses.format(bytes), port);
  }

  private static byte[] littleEndianWords(String hex, int words) {
    byte[] bytes = new byte[words * 4];
    for (int w = 0; w < words; w++) {
      for (int b = 0; b < 4; b++) {
        int offset = w * 8 + b * 2;
        bytes[w * 4 + (3 - b)] = (byte) Integer.parseInt(hex.substring(offset, offset + 2), 16);
      }
    }
    return bytes;
  }
}
