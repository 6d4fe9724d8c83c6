package io.poolscope.fixtures;

import io.poolscope.merge.RecordSchema;

import java.util.Objects;

public class Limits {
    public static final RecordSchema<Limits> SCHEMA = RecordSchema.builder(Limits.class, Limits::new)
            .leaf("cpu", Integer.class, Limits::getCpu, Limits::setCpu)
            .inheritance("cpu", Limits::setCpuInherited)
            .leaf("memory", Integer.class, Limits::getMemory, Limits::setMemory)
            .build();

    private int cpu;
    private boolean cpuInherited;
    private int memory;

    public Limits() {
    }

    public Limits(int cpu, int memory) {
        this.cpu = cpu;
        this.memory = memory;
    }

    public int getCpu() {
        return cpu;
    }

    public void setCpu(int cpu) {
        this.cpu = cpu;
    }

    public boolean isCpuInherited() {
        return cpuInherited;
    }

    public void setCpuInherited(boolean cpuInherited) {
        this.cpuInherited = cpuInherited;
    }

    public int getMemory() {
        return memory;
    }

    public void setMemory(int memory) {
        this.memory = memory;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Limits that)) return false;
        return cpu == that.cpu && memory == that.memory;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cpu, memory);
    }

    @Override
    public String toString() {
        return "Limits{cpu=" + cpu + ", memory=" + memory + "}";
    }
}
