package com.scholary.livefeed.api;

import com.scholary.livefeed.source.StreamDescriptor;

/** A catalog entry as returned by the API. The source is described without credentials. */
public record CatalogEntryResponse(
    String id, String name, String source, boolean desiredActive) {

  static CatalogEntryResponse from(StreamDescriptor descriptor) {
    return new CatalogEntryResponse(
        descriptor.id(),
        descriptor.name(),
        descriptor.source().describe(),
        descriptor.desiredActive());
  }
}
