package net.chime.core.support;

import net.chime.core.spi.TxRunner;

import java.util.concurrent.Callable;

/** 트랜잭션 없이 바로 실행 (인메모리 저장소용) */
public final class DirectTxRunner implements TxRunner {
    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return body.call();
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return body.call();
    }
}
