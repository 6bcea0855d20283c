package com.rigdef.model.element;

import java.util.EnumSet;
import java.util.Set;

import com.rigdef.model.NodeRef;
import com.rigdef.model.defaults.BeamDefaults;

import lombok.Data;

/**
 * Beam that fires an action when compressed or stretched past a limit.
 *
 * The two action values are command keys, hook group ids or an engine function and motor index,
 * depending on {@link #getActionType()}.
 */
@Data
public class Trigger {

    public enum ActionType {
        COMMAND_KEYS,
        HOOK_TOGGLE,
        ENGINE
    }

    private NodeRef node1;
    private NodeRef node2;
    private float contractionTriggerLimit;
    private float expansionTriggerLimit;
    private Set<TriggerOption> options = EnumSet.noneOf(TriggerOption.class);
    private float boundaryTimer = 1f;

    private ActionType actionType = ActionType.COMMAND_KEYS;
    private int shortboundTriggerAction;
    private int longboundTriggerAction;

    private BeamDefaults beamDefaults;
    private int detacherGroup;

    public boolean isHookToggleTrigger() {
        return options.contains(TriggerOption.UNLOCK_HOOKGROUPS_KEY)
                || options.contains(TriggerOption.LOCK_HOOKGROUPS_KEY);
    }

    public boolean isEngineTrigger() {
        return options.contains(TriggerOption.ENGINE_TRIGGER);
    }

    /**
     * @return engine input of an engine trigger, {@link EngineTriggerFunction#INVALID} otherwise
     */
    public EngineTriggerFunction getEngineFunction() {
        return actionType == ActionType.ENGINE
                ? EngineTriggerFunction.fromNumber(shortboundTriggerAction)
                : EngineTriggerFunction.INVALID;
    }
}
