package com.questrail.transducer.codec;

import com.questrail.transducer.core.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Built-in {@link StateCodec}s for common state shapes.
 */
public final class Codecs
{
    private Codecs() {}

    public static final StateCodec<Integer> INT = new StateCodec<>() {
        @Override
        public void write(Integer value, CheckpointWriter out) {
            out.writeInt(value);
        }

        @Override
        public Integer read(CheckpointReader in) {
            return in.readInt();
        }
    };

    public static final StateCodec<Long> LONG = new StateCodec<>() {
        @Override
        public void write(Long value, CheckpointWriter out) {
            out.writeLong(value);
        }

        @Override
        public Long read(CheckpointReader in) {
            return in.readLong();
        }
    };

    public static final StateCodec<Double> DOUBLE = new StateCodec<>() {
        @Override
        public void write(Double value, CheckpointWriter out) {
            out.writeDouble(value);
        }

        @Override
        public Double read(CheckpointReader in) {
            return in.readDouble();
        }
    };

    public static final StateCodec<Boolean> BOOLEAN = new StateCodec<>() {
        @Override
        public void write(Boolean value, CheckpointWriter out) {
            out.writeBoolean(value);
        }

        @Override
        public Boolean read(CheckpointReader in) {
            return in.readBoolean();
        }
    };

    public static final StateCodec<String> STRING = new StateCodec<>() {
        @Override
        public void write(String value, CheckpointWriter out) {
            out.writeString(value);
        }

        @Override
        public String read(CheckpointReader in) {
            return in.readString();
        }
    };

    public static final StateCodec<byte[]> BYTES = new StateCodec<>() {
        @Override
        public void write(byte[] value, CheckpointWriter out) {
            out.writeBytes(value);
        }

        @Override
        public byte[] read(CheckpointReader in) {
            return in.readBytes();
        }
    };

    /**
     * Codec for non-resuming transducers: writes nothing and always reads
     * back {@code initial}.
     */
    public static <S> StateCodec<S> constant(S initial) {
        return new StateCodec<>() {
            @Override
            public void write(S value, CheckpointWriter out) {
            }

            @Override
            public S read(CheckpointReader in) {
                return initial;
            }
        };
    }

    /**
     * Presence byte (0 or 1) followed by the value when present.
     */
    public static <A> StateCodec<Optional<A>> optional(StateCodec<A> codec) {
        Objects.requireNonNull(codec, "codec");
        return new StateCodec<>() {
            @Override
            public void write(Optional<A> value, CheckpointWriter out) {
                out.writeBoolean(value.isPresent());
                value.ifPresent(v -> codec.write(v, out));
            }

            @Override
            public Optional<A> read(CheckpointReader in) {
                return in.readBoolean() ? Optional.of(codec.read(in)) : Optional.empty();
            }
        };
    }

    public static <L, R> StateCodec<Pair<L, R>> pair(StateCodec<L> first, StateCodec<R> second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        return new StateCodec<>() {
            @Override
            public void write(Pair<L, R> value, CheckpointWriter out) {
                first.write(value.first(), out);
                second.write(value.second(), out);
            }

            @Override
            public Pair<L, R> read(CheckpointReader in) {
                L l = first.read(in);
                R r = second.read(in);
                return Pair.of(l, r);
            }
        };
    }

    /**
     * Element count followed by each element.
     */
    public static <A> StateCodec<List<A>> list(StateCodec<A> element) {
        Objects.requireNonNull(element, "element");
        return new StateCodec<>() {
            @Override
            public void write(List<A> value, CheckpointWriter out) {
                out.writeInt(value.size());
                for (A a : value) {
                    element.write(a, out);
                }
            }

            @Override
            public List<A> read(CheckpointReader in) {
                int size = in.readInt();
                if (size < 0) {
                    throw new CheckpointDecodeException("Negative list size " + size);
                }
                // initial capacity bounded by the bytes left
                List<A> out = new ArrayList<>(Math.min(size, in.remaining()));
                for (int i = 0; i < size; i++) {
                    out.add(element.read(in));
                }
                return Collections.unmodifiableList(out);
            }
        };
    }
}
