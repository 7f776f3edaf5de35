package com.bit.governance.database;

import java.util.List;

//KV数据库操作 按表隔离 读多写少的表自带内存缓存
public interface DataBase {

    /**
     * 创建数据库
     * @param config
     * @return
     */
    boolean createDatabase(DbConfig config);

    /**
     * 关闭数据库
     * @return
     */
    boolean closeDatabase();

    /**
     * 判断是否存在
     * @param table
     * @param key
     * @return
     */
    boolean isExist(TableEnum table, byte[] key);

    /**
     * 插入一条数据
     */
    void insert(TableEnum table, byte[] key, byte[] value);

    /**
     * 删除一条数据
     */
    void delete(TableEnum table, byte[] key);

    /**
     * 修改一条数据
     */
    void update(TableEnum table, byte[] key, byte[] value);

    /**
     * 获取一条数据
     * @return 不存在时返回 null
     */
    byte[] get(TableEnum table, byte[] key);

    /**
     * 数据数量
     */
    int count(TableEnum table);

    /**
     * 执行跨表事务（原子操作）：要么全部可见，要么全部不可见
     * @param operations 事务操作列表（包含多个表的增删改）
     * @return 事务是否成功
     */
    boolean dataTransaction(List<DbOperation> operations);

    /**
     * 迭代器遍历（支持自定义处理逻辑，避免一次性加载所有数据到内存）
     * @param table 表名
     * @param handler 迭代器处理器（处理每条键值对，键不含表前缀）
     */
    void iterate(TableEnum table, KeyValueHandler handler);

    /**
     * 获取数据库所有表名（列族名）
     */
    List<String> listAllTables();

    /**
     * 检查数据库健康状态（如是否可读写）
     */
    boolean checkHealth();

    void close();
}
