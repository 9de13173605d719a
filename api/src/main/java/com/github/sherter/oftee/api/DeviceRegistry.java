package com.github.sherter.oftee.api;

import com.github.sherter.oftee.device.DpidMapping;
import com.github.sherter.oftee.device.Injector;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.primitives.UnsignedLongs;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.Closeable;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import org.projectfloodlight.openflow.types.DatapathId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Knows which injector reaches which device. Mapping changes are queued by {@link
 * #accept(DpidMapping)} and applied in arrival order by a single updater thread; lookups may be
 * done from any thread.
 */
public class DeviceRegistry implements Consumer<DpidMapping>, Closeable {

  private static final Logger log = LoggerFactory.getLogger(DeviceRegistry.class);

  private static final Comparator<DatapathId> BY_VALUE =
      (a, b) -> UnsignedLongs.compare(a.getLong(), b.getLong());

  private final BlockingQueue<DpidMapping> updates = new LinkedBlockingQueue<>();
  private final Map<DatapathId, Injector> injectors = new HashMap<>();
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final ExecutorService updater =
      Executors.newSingleThreadExecutor(
          new ThreadFactoryBuilder().setNameFormat("oftee-dpid-mapping").setDaemon(true).build());

  public DeviceRegistry() {
    log.debug("start listening for device DPID information");
    updater.execute(this::applyUpdates);
  }

  @Override
  public void accept(DpidMapping mapping) {
    updates.add(mapping);
  }

  private void applyUpdates() {
    while (!Thread.currentThread().isInterrupted()) {
      DpidMapping mapping;
      try {
        mapping = updates.take();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      apply(mapping);
    }
  }

  private void apply(DpidMapping mapping) {
    switch (mapping.action()) {
      case ADD:
        log.debug("adding device mapping {}", mapping.dpid());
        lock.writeLock().lock();
        try {
          injectors.put(mapping.dpid(), mapping.injector());
        } finally {
          lock.writeLock().unlock();
        }
        break;
      case DELETE:
        log.debug("deleting device mapping {}", mapping.dpid());
        lock.writeLock().lock();
        try {
          injectors.remove(mapping.dpid(), mapping.injector());
        } finally {
          lock.writeLock().unlock();
        }
        break;
      default:
        log.warn("received unknown device mapping action {}", mapping);
    }
  }

  public Optional<Injector> injector(DatapathId dpid) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(injectors.get(dpid));
    } finally {
      lock.readLock().unlock();
    }
  }

  public ImmutableSortedSet<DatapathId> devices() {
    lock.readLock().lock();
    try {
      return ImmutableSortedSet.copyOf(BY_VALUE, injectors.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  @Override
  public void close() {
    updater.shutdownNow();
  }
}
