package org.vmapconv.converter.vmap;

import org.vmapconv.converter.model.Part;
import org.vmapconv.converter.model.ReconciledModel;
import org.vmapconv.converter.model.Topology;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * 写出文件级信息：元信息、单位制、实际用到的单元/积分类型、参考坐标系与材料。
 */
public final class SystemEmitter {

    private SystemEmitter() {
    }

    public static void emit(ReconciledModel model, VmapWriter writer, String exporterName, LocalDateTime now) {
        writer.writeMetaInformation(exporterName, now);
        writer.writeUnitSystem();
        Set<Topology> used = EnumSet.noneOf(Topology.class);
        for (Part part : model.parts()) {
            used.add(part.topology());
        }
        writer.writeElementTypes(used);
        writer.writeCoordinateSystems(model.coordinateSystems());
        writer.writeMaterials(model.materials());
    }
}
