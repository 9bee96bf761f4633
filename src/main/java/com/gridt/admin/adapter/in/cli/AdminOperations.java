package com.gridt.admin.adapter.in.cli;

import com.gridt.admin.application.port.in.CountUseCase;
import com.gridt.admin.application.port.in.CreateMovementsUseCase;
import com.gridt.admin.application.port.in.CreateUsersUseCase;
import com.gridt.admin.application.port.in.DeleteManyUseCase;
import com.gridt.admin.application.port.in.FindUserUseCase;
import com.gridt.admin.application.port.in.InitializeDatabaseUseCase;
import com.gridt.admin.application.port.in.RegisterUserUseCase;
import com.gridt.admin.application.port.in.SubscribeUseCase;
import com.gridt.admin.application.port.in.UnsubscribeUseCase;
import org.springframework.stereotype.Component;

/**
 * The use cases a command can reach. Keeps the CLI from knowing about services or repositories.
 */
@Component
public class AdminOperations {

    private final InitializeDatabaseUseCase initializeDatabase;
    private final CreateMovementsUseCase createMovements;
    private final CreateUsersUseCase createUsers;
    private final RegisterUserUseCase registerUser;
    private final SubscribeUseCase subscribe;
    private final UnsubscribeUseCase unsubscribe;
    private final CountUseCase count;
    private final FindUserUseCase findUser;
    private final DeleteManyUseCase deleteMany;

    public AdminOperations(
            InitializeDatabaseUseCase initializeDatabase,
            CreateMovementsUseCase createMovements,
            CreateUsersUseCase createUsers,
            RegisterUserUseCase registerUser,
            SubscribeUseCase subscribe,
            UnsubscribeUseCase unsubscribe,
            CountUseCase count,
            FindUserUseCase findUser,
            DeleteManyUseCase deleteMany) {
        this.initializeDatabase = initializeDatabase;
        this.createMovements = createMovements;
        this.createUsers = createUsers;
        this.registerUser = registerUser;
        this.subscribe = subscribe;
        this.unsubscribe = unsubscribe;
        this.count = count;
        this.findUser = findUser;
        this.deleteMany = deleteMany;
    }

    public InitializeDatabaseUseCase initializeDatabase() {
        return initializeDatabase;
    }

    public CreateMovementsUseCase createMovements() {
        return createMovements;
    }

    public CreateUsersUseCase createUsers() {
        return createUsers;
    }

    public RegisterUserUseCase registerUser() {
        return registerUser;
    }

    public SubscribeUseCase subscribe() {
        return subscribe;
    }

    public UnsubscribeUseCase unsubscribe() {
        return unsubscribe;
    }

    public CountUseCase count() {
        return count;
    }

    public FindUserUseCase findUser() {
        return findUser;
    }

    public DeleteManyUseCase deleteMany() {
        return deleteMany;
    }
}
