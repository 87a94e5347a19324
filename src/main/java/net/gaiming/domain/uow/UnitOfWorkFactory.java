package net.gaiming.domain.uow;

@FunctionalInterface
public interface UnitOfWorkFactory {

    UnitOfWork create();
}
