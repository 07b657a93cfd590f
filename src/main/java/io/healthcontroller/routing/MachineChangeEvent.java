package io.healthcontroller.routing;

import io.healthcontroller.enums.ObjectKind;
import io.healthcontroller.models.Machine;
import io.healthcontroller.models.ObjectKey;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public class MachineChangeEvent extends ObjectChangeEvent {

    private final Machine machine;

    public MachineChangeEvent(Machine machine) {
        this.machine = machine;
    }

    @Override
    public ObjectKind getKind() {
        return ObjectKind.MACHINE;
    }

    @Override
    List<ObjectKey> routeWith(EventRouter router) {
        return router.machineToPolicies(machine);
    }
}
