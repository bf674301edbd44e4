package io.github.yok.hamterm.core.hamiltonian;

import java.util.UUID;
import lombok.Value;

/**
 * ハミルトニアン（項の集約）を識別する値です。
 *
 * <p>
 * 項から集約への非所有の参照として用い、係数の差し替え時の検索キーにだけ使います。
 * </p>
 */
@Value
public class HamiltonianId {

    /**
     * 表示用の名前です。
     */
    String name;

    /**
     * 一意な識別子です。
     */
    UUID uuid;

    /**
     * 新しい識別子を発行します。
     *
     * @param name 表示用の名前です（null 不可）
     * @return 識別子です
     */
    public static HamiltonianId create(String name) {
        if (name == null) {
            throw new IllegalArgumentException("name は null 不可です");
        }
        return new HamiltonianId(name, UUID.randomUUID());
    }

    @Override
    public String toString() {
        return name + "#" + uuid.toString().substring(0, 8);
    }
}
