package com.github.sherter.oftee.endpoints;

import java.io.IOException;

/** Opens the {@link Transport} matching the kind of a {@link Destination}. */
public interface TransportFactory {

  Transport open(Destination destination) throws IOException;
}
