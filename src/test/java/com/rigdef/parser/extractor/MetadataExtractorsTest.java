package com.rigdef.parser.extractor;

import org.junit.jupiter.api.Test;

import com.rigdef.diagnostics.ParseDiagnostics;
import com.rigdef.model.Module;
import com.rigdef.model.defaults.BeamDefaults;
import com.rigdef.model.element.Author;
import com.rigdef.model.element.Fileinfo;
import com.rigdef.model.element.SkeletonSettings;
import com.rigdef.parser.RigDefParser;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MetadataExtractors.
 */
class MetadataExtractorsTest {

    private final ParseDiagnostics diagnostics = new ParseDiagnostics();

    @Test
    void testAuthorAndFileinfo() {
        Module root = parse("""
                Rig
                author chassis 123 John_Doe john@example.com
                author textures
                fileinfo 1234UID, 5, 2
                guid abc-123
                """);

        Author chassis = root.getAuthors().get(0);
        assertThat(chassis.getType()).isEqualTo("chassis");
        assertThat(chassis.isForumAccountSet()).isTrue();
        assertThat(chassis.getForumAccountId()).isEqualTo(123);
        assertThat(chassis.getName()).isEqualTo("John_Doe");
        assertThat(chassis.getEmail()).isEqualTo("john@example.com");
        assertThat(root.getAuthors().get(1).isForumAccountSet()).isFalse();

        Fileinfo fileinfo = root.getFileinfo().get(0);
        assertThat(fileinfo.getUniqueId()).isEqualTo("1234UID");
        assertThat(fileinfo.getCategoryId()).isEqualTo(5);
        assertThat(fileinfo.getFileVersion()).isEqualTo(2);
        assertThat(root.getGuid()).containsExactly("abc-123");
        assertThat(diagnostics.size()).isZero();
    }

    @Test
    void testGlobalsAndGuiSettings() {
        Module root = parse("""
                Rig
                globals
                10000, 500, chassis_mat
                guisettings
                speedoMax 140
                """);

        assertThat(root.getGlobals().get(0).getDryMass()).isEqualTo(10000f);
        assertThat(root.getGlobals().get(0).getCargoMass()).isEqualTo(500f);
        assertThat(root.getGlobals().get(0).getMaterialName()).isEqualTo("chassis_mat");
        assertThat(root.getGuiSettings().get(0).getKey()).isEqualTo("speedoMax");
        assertThat(root.getGuiSettings().get(0).getValue()).isEqualTo("140");
    }

    @Test
    void testHelpKeepsWholeLine() {
        Module root = parse("""
                Rig
                help
                help_panel_material
                """);

        assertThat(root.getHelp()).containsExactly("help_panel_material");
    }

    @Test
    void testSkeletonSettingsFallBackOnNegativeValues() {
        Module root = parse("""
                Rig
                set_skeleton_settings -1, 0.02
                set_skeleton_settings 200
                """);

        assertThat(root.getSkeletonSettings()).hasSize(1);
        SkeletonSettings settings = root.getSkeletonSettings().get(0);
        assertThat(settings.getVisibilityRangeMeters()).isEqualTo(200f);
        assertThat(settings.getBeamThicknessMeters()).isEqualTo(0.02f);
    }

    @Test
    void testSkeletonSettingsDefaults() {
        Module root = parse("""
                Rig
                set_skeleton_settings -1, -1
                """);

        SkeletonSettings settings = root.getSkeletonSettings().get(0);
        assertThat(settings.getVisibilityRangeMeters()).isEqualTo(SkeletonSettings.DEFAULT_VISIBILITY_RANGE);
        assertThat(settings.getBeamThicknessMeters()).isEqualTo(BeamDefaults.BEAM_SKELETON_DIAMETER);
    }

    @Test
    void testCollisionRangeAndFormatVersion() {
        Module root = parse("""
                Rig
                set_collision_range 0.1
                fileformatversion 2
                """);

        assertThat(root.getCollisionRanges().get(0).getNodeCollisionRange()).isEqualTo(0.1f);
        assertThat(root.getFileFormatVersions()).containsExactly(2);
    }

    private Module parse(String text) {
        return new RigDefParser(diagnostics).parse(text.lines().toList(), "test.truck").getRootModule();
    }
}
