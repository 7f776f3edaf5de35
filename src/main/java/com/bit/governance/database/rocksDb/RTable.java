package com.bit.governance.database.rocksDb;

import com.bit.governance.database.TableEnum;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.LRUCache;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

public class RTable {

    // 读多写少的表开启块缓存
    private static final long PROPOSAL_BLOCK_CACHE = 64L * 1024 * 1024;

    private RTable() {
    }

    /**
     * 获取所有列族描述符（从TableEnum动态生成，无需硬编码）
     */
    public static Map<TableEnum, ColumnFamilyDescriptor> getColumnFamilyDescriptors() {
        // 使用 LinkedHashMap 保持 TableEnum 定义的顺序
        Map<TableEnum, ColumnFamilyDescriptor> descriptors = new LinkedHashMap<>();
        for (TableEnum table : TableEnum.values()) {
            descriptors.put(
                    table,
                    new ColumnFamilyDescriptor(
                            table.getColumnFamilyName().getBytes(StandardCharsets.UTF_8), // 显式指定编码
                            columnFamilyOptions(table)
                    )
            );
        }
        return descriptors;
    }

    private static ColumnFamilyOptions columnFamilyOptions(TableEnum table) {
        ColumnFamilyOptions options = new ColumnFamilyOptions();
        if (table == TableEnum.PROPOSAL || table == TableEnum.VOTE) {
            options.setTableFormatConfig(new BlockBasedTableConfig()
                    .setBlockCache(new LRUCache(PROPOSAL_BLOCK_CACHE))
                    .setCacheIndexAndFilterBlocks(true));
        }
        return options;
    }
}
