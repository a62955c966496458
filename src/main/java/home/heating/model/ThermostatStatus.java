package home.heating.model;

import org.jetbrains.annotations.Nullable;

import java.util.List;

public class ThermostatStatus {
    private final String name;
    private final @Nullable Float temperature;
    private final float target;
    private final List<Request> requests;

    public ThermostatStatus(String name, @Nullable Float temperature, float target, List<Request> requests) {
        this.name = name;
        this.temperature = temperature;
        this.target = target;
        this.requests = requests;
    }

    public String getName() {
        return name;
    }

    public @Nullable Float getTemperature() {
        return temperature;
    }

    public float getTarget() {
        return target;
    }

    public List<Request> getRequests() {
        return requests;
    }
}
