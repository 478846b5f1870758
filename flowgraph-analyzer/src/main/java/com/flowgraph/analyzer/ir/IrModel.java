package com.flowgraph.analyzer.ir;

import com.google.gson.JsonObject;
import com.google.gson.annotations.SerializedName;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * IR POJOs. Field names use @SerializedName for JSON snake_case mapping; null fields are
 * omitted on write and read back as null.
 */
public final class IrModel {

    private IrModel() {}

    public enum BlockType {
        @SerializedName("sequence") SEQUENCE("sequence"),
        @SerializedName("if")       IF("if"),
        @SerializedName("loop")     LOOP("loop");

        private final String wireName;

        BlockType(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    /**
     * One recovered control block. {@code thenChildren}/{@code elseChildren} are used by IF
     * blocks only ({@code elseChildren} is null without an else branch); {@code bodyChildren}
     * by LOOP blocks only.
     */
    public static class ControlBlock {
        @SerializedName("block_id")      public String blockId;
        @SerializedName("block_type")    public BlockType blockType;
        @SerializedName("label")         public String label;
        @SerializedName("condition")     public String condition;
        @SerializedName("then_children") public List<ControlBlock> thenChildren;
        @SerializedName("else_children") public List<ControlBlock> elseChildren;
        @SerializedName("body_children") public List<ControlBlock> bodyChildren;
        @SerializedName("metadata")      public JsonObject metadata = new JsonObject();

        public static ControlBlock sequence(String blockId, String label) {
            ControlBlock b = new ControlBlock();
            b.blockId = blockId;
            b.blockType = BlockType.SEQUENCE;
            b.label = label;
            return b;
        }

        public static ControlBlock ifBlock(String blockId, String label, String condition) {
            ControlBlock b = new ControlBlock();
            b.blockId = blockId;
            b.blockType = BlockType.IF;
            b.label = label;
            b.condition = condition;
            b.thenChildren = new ArrayList<>();
            return b;
        }

        public static ControlBlock loop(String blockId, String label) {
            ControlBlock b = new ControlBlock();
            b.blockId = blockId;
            b.blockType = BlockType.LOOP;
            b.label = label;
            b.bodyChildren = new ArrayList<>();
            return b;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ControlBlock)) return false;
            ControlBlock that = (ControlBlock) o;
            return Objects.equals(blockId, that.blockId)
                    && blockType == that.blockType
                    && Objects.equals(label, that.label)
                    && Objects.equals(condition, that.condition)
                    && Objects.equals(thenChildren, that.thenChildren)
                    && Objects.equals(elseChildren, that.elseChildren)
                    && Objects.equals(bodyChildren, that.bodyChildren)
                    && Objects.equals(metadata, that.metadata);
        }

        @Override
        public int hashCode() {
            return Objects.hash(blockId, blockType, label, condition, thenChildren, elseChildren, bodyChildren);
        }

        @Override
        public String toString() {
            return blockType + "(" + blockId + ": " + label + ")";
        }
    }

    public static class IoParam {
        @SerializedName("type") public String type;
        @SerializedName("name") public String name;

        public IoParam() {}

        public IoParam(String type, String name) {
            this.type = type;
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof IoParam)) return false;
            IoParam that = (IoParam) o;
            return Objects.equals(type, that.type) && Objects.equals(name, that.name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(type, name);
        }
    }

    public static class FunctionIR {
        @SerializedName("id")             public String id;
        @SerializedName("name")           public String name;
        @SerializedName("signature")      public String signature;
        @SerializedName("file")           public String file;
        @SerializedName("line")           public int line;
        @SerializedName("namespace")      public String namespace;   // nullable
        @SerializedName("class_name")     public String className;   // nullable
        @SerializedName("inputs")         public List<IoParam> inputs = new ArrayList<>();
        @SerializedName("outputs")        public List<String> outputs = new ArrayList<>();
        @SerializedName("control_blocks") public List<ControlBlock> controlBlocks = new ArrayList<>();
        @SerializedName("calls")          public Set<String> calls = new LinkedHashSet<>();
        @SerializedName("complexity")     public int complexity = 1;
        @SerializedName("metadata")       public JsonObject metadata = new JsonObject();

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof FunctionIR)) return false;
            FunctionIR that = (FunctionIR) o;
            return line == that.line
                    && complexity == that.complexity
                    && Objects.equals(id, that.id)
                    && Objects.equals(name, that.name)
                    && Objects.equals(signature, that.signature)
                    && Objects.equals(file, that.file)
                    && Objects.equals(namespace, that.namespace)
                    && Objects.equals(className, that.className)
                    && Objects.equals(inputs, that.inputs)
                    && Objects.equals(outputs, that.outputs)
                    && Objects.equals(controlBlocks, that.controlBlocks)
                    && Objects.equals(calls, that.calls)
                    && Objects.equals(metadata, that.metadata);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, name, signature, file, line);
        }

        @Override
        public String toString() {
            return "FunctionIR{" + id + "}";
        }
    }

    public static class ModuleIR {
        @SerializedName("id")           public String id;
        @SerializedName("name")         public String name;
        @SerializedName("path")         public String path;
        @SerializedName("entry_points") public List<String> entryPoints = new ArrayList<>();
        @SerializedName("public_api")   public List<String> publicApi = new ArrayList<>();
        @SerializedName("private_api")  public List<String> privateApi = new ArrayList<>();
        @SerializedName("functions")    public List<String> functions = new ArrayList<>();
        @SerializedName("dependencies") public Set<String> dependencies = new LinkedHashSet<>();
        @SerializedName("metadata")     public JsonObject metadata = new JsonObject();

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ModuleIR)) return false;
            ModuleIR that = (ModuleIR) o;
            return Objects.equals(id, that.id)
                    && Objects.equals(name, that.name)
                    && Objects.equals(path, that.path)
                    && Objects.equals(entryPoints, that.entryPoints)
                    && Objects.equals(publicApi, that.publicApi)
                    && Objects.equals(privateApi, that.privateApi)
                    && Objects.equals(functions, that.functions)
                    && Objects.equals(dependencies, that.dependencies)
                    && Objects.equals(metadata, that.metadata);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, name, path);
        }

        @Override
        public String toString() {
            return "ModuleIR{" + id + "}";
        }
    }

    public static class MainFlow {
        @SerializedName("module")       public String module;
        @SerializedName("entry_points") public List<String> entryPoints = new ArrayList<>();

        public MainFlow() {}

        public MainFlow(String module, List<String> entryPoints) {
            this.module = module;
            this.entryPoints = new ArrayList<>(entryPoints);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MainFlow)) return false;
            MainFlow that = (MainFlow) o;
            return Objects.equals(module, that.module) && Objects.equals(entryPoints, that.entryPoints);
        }

        @Override
        public int hashCode() {
            return Objects.hash(module, entryPoints);
        }
    }

    public static class ProjectIR {
        @SerializedName("id")               public String id;
        @SerializedName("name")             public String name;
        @SerializedName("root_path")        public String rootPath;
        @SerializedName("modules")          public List<String> modules = new ArrayList<>();
        @SerializedName("main_flows")       public List<MainFlow> mainFlows = new ArrayList<>();
        @SerializedName("startup_sequence") public List<String> startupSequence = new ArrayList<>();
        @SerializedName("metadata")         public JsonObject metadata = new JsonObject();

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof ProjectIR)) return false;
            ProjectIR that = (ProjectIR) o;
            return Objects.equals(id, that.id)
                    && Objects.equals(name, that.name)
                    && Objects.equals(rootPath, that.rootPath)
                    && Objects.equals(modules, that.modules)
                    && Objects.equals(mainFlows, that.mainFlows)
                    && Objects.equals(startupSequence, that.startupSequence)
                    && Objects.equals(metadata, that.metadata);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, name, rootPath);
        }

        @Override
        public String toString() {
            return "ProjectIR{" + id + "}";
        }
    }
}
