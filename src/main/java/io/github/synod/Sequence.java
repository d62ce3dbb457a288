package io.github.synod;

public interface Sequence<T extends Comparable<T>> {
    T next();

    /**
     * 通知序列已经存在编号n，之后的next()必须大于n。
     */
    void set(T n);

    T current();
}
