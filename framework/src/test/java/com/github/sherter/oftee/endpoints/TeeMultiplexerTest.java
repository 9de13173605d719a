package com.github.sherter.oftee.endpoints;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.sherter.oftee.criteria.Criteria;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TeeMultiplexerTest {

  private static final byte[] MESSAGE = {1, 2, 3, 4};

  private static Endpoint endpoint(Criteria rule, Transport transport) throws Exception {
    return new Endpoint(Destination.parse("host:1"), rule, transport);
  }

  @Test
  void writesOnlyToMatchingEndpoints() throws Exception {
    RecordingTransport any = new RecordingTransport();
    RecordingTransport ipv4 = new RecordingTransport();
    RecordingTransport arp = new RecordingTransport();
    TeeMultiplexer tee =
        new TeeMultiplexer(
            ImmutableList.of(
                endpoint(Criteria.WILDCARD, any),
                endpoint(Criteria.dlType(0x0800), ipv4),
                endpoint(Criteria.dlType(0x0806), arp)));

    tee.conditionalWrite(MESSAGE, Criteria.dlType(0x0800));

    assertEquals(1, any.messages().size());
    assertArrayEquals(MESSAGE, any.messages().get(0));
    assertEquals(1, ipv4.messages().size());
    assertArrayEquals(MESSAGE, ipv4.messages().get(0));
    assertTrue(arp.messages().isEmpty());
  }

  @Test
  void wildcardStateReachesOnlyWildcardEndpoints() throws Exception {
    RecordingTransport any = new RecordingTransport();
    RecordingTransport ipv4 = new RecordingTransport();
    TeeMultiplexer tee =
        new TeeMultiplexer(
            ImmutableList.of(
                endpoint(Criteria.WILDCARD, any), endpoint(Criteria.dlType(0x0800), ipv4)));

    tee.conditionalWrite(MESSAGE, Criteria.WILDCARD);

    assertEquals(1, any.messages().size());
    assertTrue(ipv4.messages().isEmpty());
  }

  @Test
  void writesInRegistrationOrder() throws Exception {
    List<String> order = new ArrayList<>();
    TeeMultiplexer tee =
        new TeeMultiplexer(
            ImmutableList.of(
                endpoint(Criteria.WILDCARD, new NamedTransport("first", order)),
                endpoint(Criteria.WILDCARD, new NamedTransport("second", order)),
                endpoint(Criteria.WILDCARD, new NamedTransport("third", order))));

    tee.conditionalWrite(MESSAGE, Criteria.WILDCARD);

    assertEquals(ImmutableList.of("first", "second", "third"), order);
  }

  @Test
  void failingEndpointDoesNotStopTheBatch() throws Exception {
    RecordingTransport broken = new RecordingTransport();
    broken.failWrites();
    RecordingTransport healthy = new RecordingTransport();
    TeeMultiplexer tee =
        new TeeMultiplexer(
            ImmutableList.of(
                endpoint(Criteria.WILDCARD, broken), endpoint(Criteria.WILDCARD, healthy)));

    tee.conditionalWrite(MESSAGE, Criteria.WILDCARD);
    tee.conditionalWrite(MESSAGE, Criteria.WILDCARD);

    assertEquals(2, healthy.messages().size());
  }

  @Test
  void closeClosesAllTransports() throws Exception {
    RecordingTransport first = new RecordingTransport();
    RecordingTransport second = new RecordingTransport();
    TeeMultiplexer tee =
        new TeeMultiplexer(
            ImmutableList.of(
                endpoint(Criteria.WILDCARD, first), endpoint(Criteria.WILDCARD, second)));

    tee.close();

    assertTrue(first.isClosed());
    assertTrue(second.isClosed());
  }

  private static class NamedTransport implements Transport {
    private final String name;
    private final List<String> order;

    NamedTransport(String name, List<String> order) {
      this.name = name;
      this.order = order;
    }

    @Override
    public void write(byte[] message) throws IOException {
      order.add(name);
    }

    @Override
    public void close() {}
  }
}
