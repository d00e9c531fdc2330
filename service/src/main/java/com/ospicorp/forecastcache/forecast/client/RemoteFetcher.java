package com.ospicorp.forecastcache.forecast.client;

import com.ospicorp.forecastcache.forecast.model.Coordinate;
import com.ospicorp.forecastcache.forecast.model.Sample;
import java.util.List;

public interface RemoteFetcher {

  /**
   * Raw forecast samples for {@code coordinate}, in the order the source returned them.
   *
   * @throws FetchException if the source is unreachable or its response cannot be read
   */
  List<Sample> fetch(Coordinate coordinate);
}
