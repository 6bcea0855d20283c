package com.rigdef.model;

import java.util.ArrayList;
import java.util.List;

import com.rigdef.model.element.*;

import lombok.Getter;

/**
 * Named group of elements. The root module holds everything outside "section" blocks; user
 * modules are switched in and out by the consumer of the document.
 *
 * Every collection keeps declaration order.
 */
@Getter
public class Module {

    public static final String ROOT_MODULE_NAME = "_Root_";

    private final String name;

    // Structure
    private final List<Node> nodes = new ArrayList<>();
    private final List<Beam> beams = new ArrayList<>();
    private final List<Shock> shocks = new ArrayList<>();
    private final List<Shock2> shocks2 = new ArrayList<>();
    private final List<Shock3> shocks3 = new ArrayList<>();
    private final List<Hydro> hydros = new ArrayList<>();
    private final List<Command> commands = new ArrayList<>();
    private final List<Rotator> rotators = new ArrayList<>();
    private final List<Animator> animators = new ArrayList<>();
    private final List<Trigger> triggers = new ArrayList<>();
    private final List<Tie> ties = new ArrayList<>();
    private final List<Rope> ropes = new ArrayList<>();
    private final List<Ropable> ropables = new ArrayList<>();
    private final List<NodeRef> fixes = new ArrayList<>();
    private final List<NodeRef> contacters = new ArrayList<>();
    private final List<SlideNode> slideNodes = new ArrayList<>();
    private final List<RailGroup> railGroups = new ArrayList<>();
    private final List<Lockgroup> lockgroups = new ArrayList<>();
    private final List<Hook> hooks = new ArrayList<>();
    private final List<CollisionBox> collisionBoxes = new ArrayList<>();
    private final List<Minimass> minimass = new ArrayList<>();
    private final List<Cinecam> cinecams = new ArrayList<>();
    private final List<Camera> cameras = new ArrayList<>();
    private final List<CameraRail> cameraRails = new ArrayList<>();

    // Wheels
    private final List<Wheel> wheels = new ArrayList<>();
    private final List<Wheel2> wheels2 = new ArrayList<>();
    private final List<MeshWheel> meshWheels = new ArrayList<>();
    private final List<FlexBodyWheel> flexBodyWheels = new ArrayList<>();
    private final List<WheelDetacher> wheelDetachers = new ArrayList<>();

    // Aero
    private final List<Wing> wings = new ArrayList<>();
    private final List<Airbrake> airbrakes = new ArrayList<>();
    private final List<Fusedrag> fusedrag = new ArrayList<>();
    private final List<Turbojet> turbojets = new ArrayList<>();
    private final List<Turboprop> turboprops = new ArrayList<>();
    private final List<Pistonprop> pistonprops = new ArrayList<>();
    private final List<Screwprop> screwprops = new ArrayList<>();

    // Powertrain
    private final List<Engine> engines = new ArrayList<>();
    private final List<Engoption> engoptions = new ArrayList<>();
    private final List<Engturbo> engturbos = new ArrayList<>();
    private final List<TorqueCurve> torqueCurves = new ArrayList<>();
    private final List<Brakes> brakes = new ArrayList<>();
    private final List<Axle> axles = new ArrayList<>();
    private final List<InterAxle> interAxles = new ArrayList<>();
    private final List<TransferCase> transferCases = new ArrayList<>();
    private final List<TractionControl> tractionControls = new ArrayList<>();
    private final List<AntiLockBrakes> antiLockBrakes = new ArrayList<>();
    private final List<CruiseControl> cruiseControls = new ArrayList<>();
    private final List<SpeedLimiter> speedLimiters = new ArrayList<>();

    // Visuals
    private final List<Prop> props = new ArrayList<>();
    private final List<Flexbody> flexbodies = new ArrayList<>();
    private final List<Flare> flares = new ArrayList<>();
    private final List<MaterialFlareBinding> materialFlareBindings = new ArrayList<>();
    private final List<ManagedMaterial> managedMaterials = new ArrayList<>();
    private final List<Submesh> submeshes = new ArrayList<>();
    private final List<String> submeshGroundModels = new ArrayList<>();
    private final List<Exhaust> exhausts = new ArrayList<>();
    private final List<Particle> particles = new ArrayList<>();
    private final List<VideoCamera> videoCameras = new ArrayList<>();
    private final List<SoundSource> soundSources = new ArrayList<>();
    private final List<SoundSource2> soundSources2 = new ArrayList<>();
    private final List<ExtCamera> extCameras = new ArrayList<>();

    // Metadata
    private final List<Globals> globals = new ArrayList<>();
    private final List<GuiSettings> guiSettings = new ArrayList<>();
    private final List<String> help = new ArrayList<>();
    private final List<String> description = new ArrayList<>();
    private final List<Author> authors = new ArrayList<>();
    private final List<Fileinfo> fileinfo = new ArrayList<>();
    private final List<String> guid = new ArrayList<>();
    private final List<Integer> fileFormatVersions = new ArrayList<>();
    private final List<CollisionRange> collisionRanges = new ArrayList<>();
    private final List<SkeletonSettings> skeletonSettings = new ArrayList<>();

    public Module(String name) {
        this.name = name;
    }

    public boolean isRoot() {
        return ROOT_MODULE_NAME.equals(name);
    }

    @Override
    public String toString() {
        return "Module[" + name + "]";
    }
}
