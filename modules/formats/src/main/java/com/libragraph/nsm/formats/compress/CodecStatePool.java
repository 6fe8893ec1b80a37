package com.libragraph.nsm.formats.compress;

import com.libragraph.nsm.formats.api.ArchiveError;
import com.libragraph.nsm.formats.api.ArchiveException;
import com.libragraph.nsm.formats.api.CodecState;
import com.libragraph.nsm.formats.api.FrameCodec;
import com.libragraph.nsm.formats.api.FrameDecoder;
import com.libragraph.nsm.formats.api.FrameEncoder;
import com.libragraph.nsm.formats.registry.CodecRegistry;
import com.libragraph.nsm.types.CompressionType;
import org.apache.commons.pool2.BaseKeyedPooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericKeyedObjectPool;
import org.apache.commons.pool2.impl.GenericKeyedObjectPoolConfig;
import org.jboss.logging.Logger;

import java.util.function.Function;

/**
 * Keyed pools of encoder and decoder states, one key per algorithm.
 * Each key is capped at the engine's permit count, so a permit holder never
 * waits for a state.
 */
final class CodecStatePool implements AutoCloseable {

    private static final Logger log = Logger.getLogger(CodecStatePool.class);

    private final GenericKeyedObjectPool<CompressionType, FrameEncoder> encoders;
    private final GenericKeyedObjectPool<CompressionType, FrameDecoder> decoders;

    CodecStatePool(CodecRegistry registry, int maxPerKey) {
        this.encoders = new GenericKeyedObjectPool<>(
                new StateFactory<>(registry, FrameCodec::newEncoder), config(maxPerKey));
        this.decoders = new GenericKeyedObjectPool<>(
                new StateFactory<>(registry, FrameCodec::newDecoder), config(maxPerKey));
    }

    private static <S> GenericKeyedObjectPoolConfig<S> config(int maxPerKey) {
        GenericKeyedObjectPoolConfig<S> config = new GenericKeyedObjectPoolConfig<>();
        config.setMaxTotalPerKey(maxPerKey);
        config.setMaxIdlePerKey(maxPerKey);
        config.setMaxTotal(-1);
        config.setBlockWhenExhausted(true);
        config.setJmxEnabled(false);
        return config;
    }

    CodecLease<FrameEncoder> borrowEncoder(CompressionType type) {
        return borrow(encoders, type, ArchiveError.ARCHIVE_WRITE_FAILURE);
    }

    CodecLease<FrameDecoder> borrowDecoder(CompressionType type) {
        return borrow(decoders, type, ArchiveError.ARCHIVE_READ_FAILURE);
    }

    int idleEncoders(CompressionType type) {
        return encoders.getNumIdle(type);
    }

    int idleDecoders(CompressionType type) {
        return decoders.getNumIdle(type);
    }

    private static <S extends CodecState> CodecLease<S> borrow(
            GenericKeyedObjectPool<CompressionType, S> pool, CompressionType type, ArchiveError error) {
        try {
            return new CodecLease<>(pool, type, pool.borrowObject(type));
        } catch (ArchiveException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArchiveException(error, "Interrupted waiting for " + type.label() + " codec state", e);
        } catch (Exception e) {
            throw new ArchiveException(error, "Failed to obtain " + type.label() + " codec state", e);
        }
    }

    @Override
    public void close() {
        encoders.close();
        decoders.close();
    }

    private static final class StateFactory<S extends CodecState>
            extends BaseKeyedPooledObjectFactory<CompressionType, S> {

        private final CodecRegistry registry;
        private final Function<FrameCodec, S> creator;

        StateFactory(CodecRegistry registry, Function<FrameCodec, S> creator) {
            this.registry = registry;
            this.creator = creator;
        }

        @Override
        public S create(CompressionType key) {
            log.debugf("Creating %s codec state", key.label());
            return creator.apply(registry.require(key));
        }

        @Override
        public PooledObject<S> wrap(S value) {
            return new DefaultPooledObject<>(value);
        }

        @Override
        public void passivateObject(CompressionType key, PooledObject<S> p) {
            p.getObject().reset();
        }

        @Override
        public void destroyObject(CompressionType key, PooledObject<S> p) {
            log.debugf("Destroying %s codec state", key.label());
            p.getObject().destroy();
        }
    }
}
