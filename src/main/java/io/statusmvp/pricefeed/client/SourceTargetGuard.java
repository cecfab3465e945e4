package io.statusmvp.pricefeed.client;

import io.statusmvp.pricefeed.config.FeedProperties;
import io.statusmvp.pricefeed.error.FetchException;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Rejects source URLs that point at local or private networks. Only active in strict mode; DNS
 * resolution blocks, so callers run {@link #check} off the event loop.
 */
@Component
public class SourceTargetGuard {
  private final boolean enabled;

  @Autowired
  public SourceTargetGuard(FeedProperties properties) {
    this(properties.isStrictSourceTargets() && !properties.isAllowPrivateTargets());
  }

  SourceTargetGuard(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void check(String sourceId, URI uri) {
    if (!enabled) return;
    if (uri.getScheme() == null || uri.getHost() == null || uri.getHost().isBlank()) {
      throw new FetchException(sourceId, "invalid source url");
    }
    if (uri.getRawUserInfo() != null) {
      throw new FetchException(sourceId, "source url must not include userinfo");
    }
    String host = uri.getHost().toLowerCase(Locale.ROOT);
    if (host.endsWith(".")) host = host.substring(0, host.length() - 1);
    if (host.startsWith("[") && host.endsWith("]")) host = host.substring(1, host.length() - 1);
    if (host.equals("localhost") || host.endsWith(".localhost")) {
      throw new FetchException(sourceId, "source hostname not allowed in strict mode");
    }

    InetAddress[] addresses;
    try {
      addresses = InetAddress.getAllByName(host);
    } catch (UnknownHostException e) {
      throw new FetchException(sourceId, "failed to resolve source hostname " + host, e);
    }
    if (addresses.length == 0) {
      throw new FetchException(sourceId, "failed to resolve source hostname " + host);
    }
    for (InetAddress address : addresses) {
      if (isDisallowed(address)) {
        throw new FetchException(
            sourceId, "source host " + host + " resolves to a private or local address");
      }
    }
  }

  static boolean isDisallowed(InetAddress ip) {
    if (ip == null) return true;
    if (ip.isLoopbackAddress()
        || ip.isLinkLocalAddress()
        || ip.isMulticastAddress()
        || ip.isAnyLocalAddress()
        || ip.isSiteLocalAddress()) {
      return true;
    }
    byte[] b = ip.getAddress();
    if (ip instanceof Inet4Address) {
      // Carrier-grade NAT, 100.64.0.0/10
      int first = b[0] & 0xff;
      int second = b[1] & 0xff;
      return first == 100 && second >= 64 && second <= 127;
    }
    if (ip instanceof Inet6Address) {
      // Unique local, fc00::/7
      return (b[0] & 0xfe) == 0xfc;
    }
    return false;
  }
}
