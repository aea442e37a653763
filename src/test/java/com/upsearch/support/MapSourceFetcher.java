package com.upsearch.support;

import com.upsearch.source.FetchFailedException;
import com.upsearch.source.SourceFetcher;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory fetcher serving archives by location.
 */
public class MapSourceFetcher implements SourceFetcher {

    private final Map<String, byte[]> archives = new HashMap<>();
    private final List<String> fetched = new ArrayList<>();

    public MapSourceFetcher put(String location, byte[] archive) {
        archives.put(location, archive);
        return this;
    }

    public List<String> getFetched() {
        return fetched;
    }

    @Override
    public byte[] fetch(String location) {
        fetched.add(location);
        byte[] archive = archives.get(location);
        if (archive == null) {
            throw new FetchFailedException(location, "HTTP 404 from " + location);
        }
        return archive;
    }
}
