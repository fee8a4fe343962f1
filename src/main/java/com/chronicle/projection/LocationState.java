package com.chronicle.projection;

import java.util.List;

public record LocationState(String area, String place, String position, List<String> props) {

    public static final LocationState UNKNOWN = new LocationState(null, null, null, List.of());

    public LocationState {
        props = props == null ? List.of() : List.copyOf(props);
    }
}
