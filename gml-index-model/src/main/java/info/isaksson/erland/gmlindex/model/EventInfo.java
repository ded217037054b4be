package info.isaksson.erland.gmlindex.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Object event metadata from a manifest's event list. Type and number are optional. */
@JsonPropertyOrder({"name","eventType","eventNum"})
public final class EventInfo {
    public final String name;
    public final Integer eventType;
    public final Integer eventNum;

    @JsonCreator
    public EventInfo(
            @JsonProperty("name") String name,
            @JsonProperty("eventType") Integer eventType,
            @JsonProperty("eventNum") Integer eventNum
    ) {
        this.name = name;
        this.eventType = eventType;
        this.eventNum = eventNum;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventInfo)) return false;
        EventInfo that = (EventInfo) o;
        return Objects.equals(name, that.name) && Objects.equals(eventType, that.eventType) && Objects.equals(eventNum, that.eventNum);
    }

    @Override public int hashCode() {
        return Objects.hash(name, eventType, eventNum);
    }
}
