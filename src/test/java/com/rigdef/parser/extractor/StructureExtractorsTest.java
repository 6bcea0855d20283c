package com.rigdef.parser.extractor;

import org.junit.jupiter.api.Test;

import com.rigdef.diagnostics.ParseDiagnostics;
import com.rigdef.model.GeneratedNodeRange;
import com.rigdef.model.Module;
import com.rigdef.model.NodeRef;
import com.rigdef.model.RigDocument;
import com.rigdef.model.element.AeroEngineSource;
import com.rigdef.model.element.Animator;
import com.rigdef.model.element.AnimatorOption;
import com.rigdef.model.element.Beam;
import com.rigdef.model.element.BeamOption;
import com.rigdef.model.element.Command;
import com.rigdef.model.element.Hook;
import com.rigdef.model.element.Node;
import com.rigdef.model.element.NodeOption;
import com.rigdef.model.element.SlideNode;
import com.rigdef.model.element.SlideNodeConstraint;
import com.rigdef.model.element.Trigger;
import com.rigdef.parser.RigDefParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StructureExtractors.
 */
class StructureExtractorsTest {

    private final ParseDiagnostics diagnostics = new ParseDiagnostics();

    @Test
    void testNodeOptionsAndLoadWeight() {
        Module root = parse("""
                Rig
                nodes
                1, 0, 0, 0, l, 25
                2, 0, 0, 0, nm
                3, 0, 0, 0, x, 10
                4, 0, 0, 0, q
                """);

        Node loaded = root.getNodes().get(0);
        assertThat(loaded.getOptions()).containsExactly(NodeOption.LOAD_WEIGHT);
        assertThat(loaded.isLoadWeightOverrideSet()).isTrue();
        assertThat(loaded.getLoadWeightOverride()).isEqualTo(25f);

        assertThat(root.getNodes().get(1).getOptions()).containsExactly(NodeOption.NO_MOUSE_GRAB);
        assertThat(root.getNodes().get(2).isLoadWeightOverrideSet()).isFalse();
        assertThat(root.getNodes()).hasSize(4);
        assertThat(diagnostics.getWarnings()).hasSize(2);
        assertThat(diagnostics.getWarnings().get(0)).contains("option 'l' is not present");
        assertThat(diagnostics.getWarnings().get(1)).contains("invalid option 'q'");
    }

    @Test
    void testNodeDefaultsCaptured() {
        Module root = parse("""
                Rig
                set_node_defaults 12, 0.5, -1, -1, f
                nodes
                1, 0, 0, 0
                """);

        Node node = root.getNodes().get(0);
        assertThat(node.getNodeDefaults().getLoadWeight()).isEqualTo(12f);
        assertThat(node.getNodeDefaults().getFriction()).isEqualTo(0.5f);
        assertThat(node.getNodeDefaults().getVolume()).isEqualTo(1f);
        assertThat(node.getNodeDefaults().getOptions()).containsExactly(NodeOption.NO_SPARKS);
    }

    @Test
    void testBeamOptions() {
        Module root = parse("""
                Rig
                beams
                1, 2, iv
                1, 2, s, 3
                1, 2, s, -1
                1, 2, z
                """);

        assertThat(root.getBeams()).hasSize(4);
        assertThat(root.getBeams().get(0).getOptions()).containsExactly(BeamOption.INVISIBLE);
        Beam support = root.getBeams().get(1);
        assertThat(support.getOptions()).containsExactly(BeamOption.SUPPORT);
        assertThat(support.isExtensionBreakLimitSet()).isTrue();
        assertThat(support.getExtensionBreakLimit()).isEqualTo(3f);
        assertThat(root.getBeams().get(2).getExtensionBreakLimit()).isZero();
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("ignoring invalid option 'z'");
    }

    @Test
    void testCommandsFormatOneCopiesRate() {
        Module root = parse("""
                Rig
                commands
                1, 2, 0.3, 0.5, 1.5, 3, 4
                """);

        Command command = root.getCommands().get(0);
        assertThat(command.getFormatVersion()).isEqualTo(1);
        assertThat(command.getShortenRate()).isEqualTo(0.3f);
        assertThat(command.getLengthenRate()).isEqualTo(0.3f);
        assertThat(command.getContractKey()).isEqualTo(3);
        assertThat(command.getExtendKey()).isEqualTo(4);
        assertThat(command.isNeedsEngine()).isTrue();
    }

    @Test
    void testCommands2OptionConflicts() {
        Module root = parse("""
                Rig
                commands2
                1, 2, 0.1, 0.2, 0.5, 1.5, 3, 4, pc, Lift_arm
                1, 2, 0.1, 0.2, 0.5, 1.5, 5, 6, co
                """);

        Command first = root.getCommands().get(0);
        assertThat(first.getFormatVersion()).isEqualTo(2);
        assertThat(first.getLengthenRate()).isEqualTo(0.2f);
        assertThat(first.isOnePress()).isTrue();
        assertThat(first.isAutoCenter()).isFalse();
        assertThat(first.getDescription()).isEqualTo("Lift_arm");

        Command second = root.getCommands().get(1);
        assertThat(second.isAutoCenter()).isTrue();
        assertThat(second.isOnePressCenter()).isFalse();

        assertThat(diagnostics.getWarnings()).containsExactly(
                "test.truck:3 (commands2): Command cannot be one-pressed and self centering at the same time, ignoring flag 'c'",
                "test.truck:4 (commands2): Command cannot be one-pressed and self centering at the same time, ignoring flag 'o'");
    }

    @Test
    void testAnimatorOptions() {
        Module root = parse("""
                Rig
                animators
                1, 2, 0.5, vis | throttle2 | shortlimit:0.2 | bogus
                """);

        Animator animator = root.getAnimators().get(0);
        assertThat(animator.getNode2().getText()).isEqualTo("2");
        assertThat(animator.getNode2().isNumericValid()).isTrue();
        assertThat(animator.getLengtheningFactor()).isEqualTo(0.5f);
        assertThat(animator.getFlags()).containsExactlyInAnyOrder(AnimatorOption.VISIBLE, AnimatorOption.SHORT_LIMIT);
        assertThat(animator.getShortLimit()).isEqualTo(0.2f);
        assertThat(animator.getAeroFlags()).containsExactly(AeroEngineSource.THROTTLE);
        assertThat(animator.getAeroEngineIndex()).isEqualTo(1);
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("ignoring invalid option 'bogus'");
    }

    @Test
    void testTriggerActionTypes() {
        Module root = parse("""
                Rig
                triggers
                1, 2, 0.1, 0.2, 3, 4, H, 2.5
                1, 2, 0.1, 0.2, 1, 0, E
                1, 2, 0.1, 0.2, 3, 4
                """);

        Trigger hook = root.getTriggers().get(0);
        assertThat(hook.getActionType()).isEqualTo(Trigger.ActionType.HOOK_TOGGLE);
        assertThat(hook.getBoundaryTimer()).isEqualTo(2.5f);
        assertThat(root.getTriggers().get(1).getActionType()).isEqualTo(Trigger.ActionType.ENGINE);
        assertThat(root.getTriggers().get(2).getActionType()).isEqualTo(Trigger.ActionType.COMMAND_KEYS);
        assertThat(root.getTriggers().get(2).getBoundaryTimer()).isEqualTo(1f);
    }

    @Test
    void testSlideNodes() {
        Module root = parse("""
                Rig
                slidenodes
                5, 1, 2, 3, S1000, G2, Ca
                6, 1, Cz
                7
                """);

        assertThat(root.getSlideNodes()).hasSize(2);
        SlideNode slide = root.getSlideNodes().get(0);
        assertThat(slide.getSlideNode().getText()).isEqualTo("5");
        assertThat(slide.getRailNodes()).extracting(NodeRef::getText).containsExactly("1", "2", "3");
        assertThat(slide.getSpringRate()).isEqualTo(1000f);
        assertThat(slide.getRailgroupId()).isEqualTo(2);
        assertThat(slide.getBreakForce()).isNull();
        assertThat(slide.getConstraints()).containsExactly(SlideNodeConstraint.ATTACH_ALL);
        assertThat(diagnostics.getWarnings()).hasSize(2);
    }

    @Test
    void testRailAndLockGroups() {
        Module root = parse("""
                Rig
                railgroups
                1, 3, 4, 5
                lockgroups
                2, 7, 8
                """);

        assertThat(root.getRailGroups().get(0).getId()).isEqualTo(1);
        assertThat(root.getRailGroups().get(0).getNodes()).extracting(NodeRef::getText).containsExactly("3", "4", "5");
        assertThat(root.getLockgroups().get(0).getNumber()).isEqualTo(2);
        assertThat(root.getLockgroups().get(0).getNodes()).hasSize(2);
    }

    @Test
    void testHookAttributes() {
        Module root = parse("""
                Rig
                hooks
                1, hookrange, 0.5, self-lock, auto_lock, nodisable, visible, weird
                """);

        Hook hook = root.getHooks().get(0);
        assertThat(hook.getHookRange()).isEqualTo(0.5f);
        assertThat(hook.isSelfLock()).isTrue();
        assertThat(hook.isAutoLock()).isTrue();
        assertThat(hook.isNoDisable()).isTrue();
        assertThat(hook.isNoRope()).isFalse();
        assertThat(hook.isVisible()).isTrue();
        assertThat(hook.getSpeedCoef()).isEqualTo(1f);
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("ignoring invalid option 'weird'");
    }

    @Test
    void testMinimassIsSingleLine() {
        Module root = parse("""
                Rig
                minimass
                50, l
                60
                """);

        assertThat(root.getMinimass()).hasSize(1);
        assertThat(root.getMinimass().get(0).getGlobalMinMassKg()).isEqualTo(50f);
    }

    @Test
    void testCameraRailIsStagedUntilSectionEnds() {
        Module root = parse("""
                Rig
                camerarail
                1
                2
                end
                camerarail
                end
                """);

        assertThat(root.getCameraRails()).hasSize(1);
        assertThat(root.getCameraRails().get(0).getNodes()).hasSize(2);
        assertThat(diagnostics.getWarnings()).singleElement().asString()
                .contains("Empty section 'camerarail', ignoring...");
    }

    @Test
    void testCinecamGeneratesOneNode() {
        Module root = parse("""
                Rig
                nodes
                0, 0, 0, 0
                1, 1, 0, 0
                2, 0, 1, 0
                cinecam
                0.5, 1, 2, 0, 1, 2, 0, 1, 2, 0, 1, 9000, 900, 30
                """);

        assertThat(root.getCinecams()).hasSize(1);
        assertThat(root.getCinecams().get(0).getNodes()).hasSize(8);
        assertThat(root.getCinecams().get(0).getSpring()).isEqualTo(9000f);
        assertThat(root.getCinecams().get(0).getNodeMass()).isEqualTo(30f);
        assertThat(root.getCinecams().get(0).getGeneratedNodes()).isEqualTo(new GeneratedNodeRange(3, 1));
    }

    private Module parse(String text) {
        RigDocument doc = new RigDefParser(diagnostics).parse(text.lines().toList(), "test.truck");
        return doc.getRootModule();
    }
}
