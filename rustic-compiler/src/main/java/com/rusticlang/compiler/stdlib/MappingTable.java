package com.rusticlang.compiler.stdlib;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 标准库映射表（不可变，进程内共享）
 *
 * <p>按 (模块名, 函数名, 参数个数) 索引。标准表从类路径资源
 * {@value #RESOURCE} 惰性加载一次，之后可被多个编译线程并发读取。</p>
 */
public final class MappingTable {

    public static final String RESOURCE = "rustic/stdlib-mapping.json";
    public static final int FORMAT_VERSION = 1;

    private final String version;
    private final Map<String, MappingEntry> entries;
    private final Set<String> modules;

    MappingTable(String version, Collection<MappingEntry> entries) {
        this.version = version;
        Map<String, MappingEntry> map = new LinkedHashMap<String, MappingEntry>();
        Set<String> mods = new LinkedHashSet<String>();
        for (MappingEntry e : entries) {
            String key = key(e.getModule(), e.getName(), e.getArity());
            if (map.containsKey(key)) {
                throw new MappingTableException("Duplicate mapping entry: " + e.getQualifiedName()
                        + "/" + e.getArity());
            }
            map.put(key, e);
            mods.add(e.getModule());
        }
        this.entries = Collections.unmodifiableMap(map);
        this.modules = Collections.unmodifiableSet(mods);
    }

    /**
     * 获取标准映射表
     *
     * @throws MappingTableException 资源缺失或内容非法
     */
    public static MappingTable standard() {
        return StandardHolder.INSTANCE;
    }

    /**
     * 从 JSON 读取映射表
     */
    public static MappingTable load(Reader reader) {
        return new MappingTableLoader().load(reader);
    }

    /** 表数据的版本标识 */
    public String getVersion() {
        return version;
    }

    /**
     * 查找条目
     *
     * @return 不存在返回 null
     */
    public MappingEntry lookup(String module, String name, int arity) {
        return entries.get(key(module, name, arity));
    }

    /** 同名但参数个数不同的条目（用于 ArityError 提示） */
    public List<MappingEntry> overloads(String module, String name) {
        List<MappingEntry> result = new ArrayList<MappingEntry>();
        for (MappingEntry e : entries.values()) {
            if (e.getModule().equals(module) && e.getName().equals(name)) {
                result.add(e);
            }
        }
        return result;
    }

    public boolean hasModule(String module) {
        return modules.contains(module);
    }

    public Set<String> getModules() {
        return modules;
    }

    public Collection<MappingEntry> getEntries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    private static String key(String module, String name, int arity) {
        return module + "." + name + "/" + arity;
    }

    private static final class StandardHolder {
        static final MappingTable INSTANCE = loadStandard();

        private static MappingTable loadStandard() {
            InputStream in = MappingTable.class.getClassLoader().getResourceAsStream(RESOURCE);
            if (in == null) {
                throw new MappingTableException("Mapping table resource not found: " + RESOURCE);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                return load(reader);
            } catch (IOException e) {
                throw new MappingTableException("Failed to read mapping table: " + RESOURCE, e);
            }
        }
    }
}
