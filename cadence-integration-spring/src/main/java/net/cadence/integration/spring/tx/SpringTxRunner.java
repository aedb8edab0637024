package net.cadence.integration.spring.tx;

import net.cadence.adapter.jdbc.TxContext;
import net.cadence.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/** 스프링 트랜잭션 매니저 위에서 동작하는 TxRunner. 리포지토리는 TxContext 로 커넥션을 받는다 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.required = template(tm, TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = template(tm, TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ds = ds;
    }

    private static TransactionTemplate template(PlatformTransactionManager tm, int propagation) {
        var tpl = new TransactionTemplate(tm);
        tpl.setPropagationBehavior(propagation);
        return tpl;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        return execute(required, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        return execute(requiresNew, body);
    }

    private <T> T execute(TransactionTemplate tpl, Callable<T> body) throws Exception {
        try {
            return tpl.execute(status -> {
                // 스프링이 바인딩한 커넥션을 TxContext 에 꽂는다. REQUIRES_NEW 면 새 커넥션이 나오므로 바깥 것은 잠시 내려둔다
                Connection outer = TxContext.get();
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedFailure(e);
                } finally {
                    if (outer != null) TxContext.set(outer);
                    else TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds);
                }
            });
        } catch (CheckedFailure f) {
            throw f.checked;
        }
    }

    /** 콜백 밖으로 checked 예외를 운반 (롤백은 RuntimeException 기준으로 일어난다) */
    private static final class CheckedFailure extends RuntimeException {
        final Exception checked;

        CheckedFailure(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
