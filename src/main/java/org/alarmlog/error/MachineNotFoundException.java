package org.alarmlog.error;

import org.alarmlog.result.FailureReason;

import java.util.List;

public class MachineNotFoundException extends AlarmEngineException {

    private final String requestedSerial;
    private final List<String> availableSerials;

    public MachineNotFoundException(String requestedSerial, List<String> availableSerials) {
        super(FailureReason.MACHINE_NOT_FOUND, "Machine " + requestedSerial + " not found in data. Available: "
                + String.join(", ", availableSerials));
        this.requestedSerial = requestedSerial;
        this.availableSerials = List.copyOf(availableSerials);
    }

    public String getRequestedSerial() {
        return requestedSerial;
    }

    public List<String> getAvailableSerials() {
        return availableSerials;
    }
}
