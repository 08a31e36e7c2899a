package mixfix.library;

import mixfix.elaborator.GlobalConstant;
import mixfix.elaborator.GlobalEnvironment;
import mixfix.trans.extension.ExtensionLifecycle;
import mixfix.trans.extension.ExtensionObject;

import java.util.*;
import java.util.logging.Logger;

/**
 * <p>
 * A minimal persistence framework driving an {@link ExtensionLifecycle}: it records the extension objects of the
 * current section or module and replays them as sections close, modules are imported and functors are
 * instantiated.
 * </p>
 *
 * <ul>
 *     <li>Opening a section or module freezes every registered {@link Summary}; closing it restores them, so
 *     nothing declared inside survives by itself.</li>
 *     <li>Closing a section then re-caches the objects it exports into the enclosing frame.</li>
 *     <li>Ending a module records its objects and loads them; importing the module opens them.</li>
 *     <li>Instantiating a functor substitutes its objects and its constants into a new module.</li>
 * </ul>
 */
public class Library {

	private static final Logger logger = Logger.getLogger("Mixfix Library");

	private final ExtensionLifecycle lifecycle;
	private final GlobalEnvironment env;
	private final List<Summary<?>> summaries;
	private final Deque<Frame> frames;
	private final Map<List<String>, ModuleRecord> modules;

	private enum FrameKind {
		ROOT,
		SECTION,
		MODULE,
	}

	private static class Frame {
		final FrameKind kind;
		final String name;
		final List<Runnable> restorers;
		final List<ExtensionObject> objects;
		final List<List<String>> submodules;

		Frame(FrameKind kind, String name, List<Runnable> restorers) {
			this.kind = kind;
			this.name = name;
			this.restorers = restorers;
			this.objects = new ArrayList<>();
			this.submodules = new ArrayList<>();
		}
	}

	public static class ModuleRecord {
		private final List<String> path;
		private final List<ExtensionObject> objects;
		private final List<List<String>> submodules;

		public ModuleRecord(List<String> path, List<ExtensionObject> objects, List<List<String>> submodules) {
			this.path = Collections.unmodifiableList(new ArrayList<>(path));
			this.objects = Collections.unmodifiableList(new ArrayList<>(objects));
			this.submodules = Collections.unmodifiableList(new ArrayList<>(submodules));
		}

		public List<String> getPath() {
			return path;
		}

		public List<ExtensionObject> getObjects() {
			return objects;
		}

		public List<List<String>> getSubmodules() {
			return submodules;
		}
	}

	public Library(ExtensionLifecycle lifecycle, GlobalEnvironment env, List<Summary<?>> summaries) {
		this.lifecycle = lifecycle;
		this.env = env;
		this.summaries = new ArrayList<>(summaries);
		this.frames = new ArrayDeque<>();
		this.modules = new HashMap<>();
		this.frames.push(new Frame(FrameKind.ROOT, "", Collections.emptyList()));
	}

	private static <S> Runnable capture(Summary<S> summary) {
		S frozen = summary.freeze();
		return () -> summary.unfreeze(frozen);
	}

	private List<Runnable> freezeAll() {
		List<Runnable> restorers = new ArrayList<>();
		for (Summary<?> summary : summaries) {
			restorers.add(capture(summary));
		}
		return restorers;
	}

	/**
	 * Installs an object and records it in the current frame.
	 */
	public void addAnonymousLeaf(ExtensionObject obj) {
		lifecycle.cache(obj);
		frames.peek().objects.add(obj);
	}

	/**
	 * @return the path of the module being defined, empty at top level
	 */
	public List<String> currentModulePath() {
		List<String> path = new ArrayList<>();
		Iterator<Frame> it = frames.descendingIterator();
		while (it.hasNext()) {
			Frame frame = it.next();
			if (frame.kind == FrameKind.MODULE) {
				path.add(frame.name);
			}
		}
		return path;
	}

	public void openSection(String name) {
		frames.push(new Frame(FrameKind.SECTION, name, freezeAll()));
		logger.fine("opened section " + name);
	}

	public void closeSection(String name) {
		Frame frame = popFrame(FrameKind.SECTION, name);
		for (Runnable restorer : frame.restorers) {
			restorer.run();
		}
		Frame parent = frames.peek();
		for (ExtensionObject obj : frame.objects) {
			Optional<ExtensionObject> exported = lifecycle.export(obj);
			if (exported.isPresent()) {
				lifecycle.cache(exported.get());
				parent.objects.add(exported.get());
			}
		}
		parent.submodules.addAll(frame.submodules);
		logger.fine("closed section " + name);
	}

	public void beginModule(String name) {
		frames.push(new Frame(FrameKind.MODULE, name, freezeAll()));
		logger.fine("began module " + name);
	}

	public ModuleRecord endModule(String name) {
		List<String> path = currentModulePath();
		Frame frame = popFrame(FrameKind.MODULE, name);
		for (Runnable restorer : frame.restorers) {
			restorer.run();
		}
		ModuleRecord record = new ModuleRecord(path, frame.objects, frame.submodules);
		registerModule(record);
		frames.peek().submodules.add(path);
		logger.info("defined module " + String.join(".", path) + " with " + frame.objects.size() + " object(s)");
		return record;
	}

	private void registerModule(ModuleRecord record) {
		modules.put(record.getPath(), record);
		loadModule(record, 1);
	}

	private void loadModule(ModuleRecord record, int depth) {
		for (ExtensionObject obj : record.getObjects()) {
			lifecycle.load(depth, obj);
		}
		for (List<String> submodule : record.getSubmodules()) {
			ModuleRecord sub = modules.get(submodule);
			if (sub != null) {
				loadModule(sub, depth + 1);
			}
		}
	}

	private void openModule(ModuleRecord record, int depth) {
		for (ExtensionObject obj : record.getObjects()) {
			lifecycle.open(depth, obj);
		}
		for (List<String> submodule : record.getSubmodules()) {
			ModuleRecord sub = modules.get(submodule);
			if (sub != null) {
				openModule(sub, depth + 1);
			}
		}
	}

	public Optional<ModuleRecord> getModule(String dotted) {
		return Optional.ofNullable(modules.get(Arrays.asList(dotted.split("\\."))));
	}

	/**
	 * Makes a module's syntax active: its own objects are opened, those of its sub-modules only loaded.
	 */
	public void importModule(String dotted) {
		ModuleRecord record = modules.get(Arrays.asList(dotted.split("\\.")));
		if (record == null) {
			throw new IllegalArgumentException("no module named " + dotted);
		}
		loadModule(record, 1);
		openModule(record, 1);
		logger.info("imported module " + dotted);
	}

	/**
	 * Defines {@code instance} as {@code functor} with its parameter modules replaced according to
	 * {@code arguments}. The new module's objects are the functor's, substituted; nested modules are instantiated
	 * under the new path the same way, and the functor's constants are copied there too.
	 */
	public ModuleRecord instantiateFunctor(String functor, String instance, ModuleSubstitution arguments) {
		ModuleRecord record = modules.get(Arrays.asList(functor.split("\\.")));
		if (record == null) {
			throw new IllegalArgumentException("no module named " + functor);
		}
		ModuleSubstitution substitution = arguments.and(functor, instance);
		for (GlobalConstant constant : env.constantsInModule(record.getPath())) {
			env.addConstant(substitution.apply(constant.getName()), constant.getImplicitArguments());
		}
		ModuleRecord result = instantiateRecord(record, Arrays.asList(instance.split("\\.")), substitution);
		loadModule(result, 1);
		logger.info("instantiated " + functor + " as " + instance + " with " + substitution);
		return result;
	}

	private ModuleRecord instantiateRecord(ModuleRecord record, List<String> path, ModuleSubstitution substitution) {
		List<ExtensionObject> objects = new ArrayList<>();
		for (ExtensionObject obj : record.getObjects()) {
			switch (lifecycle.classify(obj)) {
				case SUBSTITUTE:
					objects.add(lifecycle.subst(substitution, obj));
					break;
				case KEEP:
					objects.add(obj);
					break;
				case DISPOSE:
					break;
			}
		}
		List<List<String>> submodules = new ArrayList<>();
		for (List<String> submodule : record.getSubmodules()) {
			ModuleRecord sub = modules.get(submodule);
			if (sub == null) {
				continue;
			}
			List<String> subPath = new ArrayList<>(path);
			subPath.addAll(submodule.subList(record.getPath().size(), submodule.size()));
			instantiateRecord(sub, subPath, substitution);
			submodules.add(subPath);
		}
		ModuleRecord result = new ModuleRecord(path, objects, submodules);
		modules.put(result.getPath(), result);
		return result;
	}

	private Frame popFrame(FrameKind kind, String name) {
		Frame frame = frames.peek();
		if (frame.kind != kind || !frame.name.equals(name)) {
			throw new IllegalStateException("cannot close " + kind.toString().toLowerCase() + " " + name +
					", innermost open frame is " + frame.kind.toString().toLowerCase() + " " + frame.name);
		}
		return frames.pop();
	}
}
