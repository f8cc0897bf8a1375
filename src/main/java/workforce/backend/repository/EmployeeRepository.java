package workforce.backend.repository;

import workforce.backend.model.Employee;

import java.util.List;
import java.util.Optional;

/**
 * Employee skill profiles, keyed by tenant and employee id.
 */
public interface EmployeeRepository {

    /**
     * Insert the profile, or replace every field of an existing one except its creation time.
     */
    void save(Employee employee);

    Optional<Employee> findById(String tenantId, String employeeId);

    /**
     * All profiles of a tenant, active or not, ordered by name.
     */
    List<Employee> findByTenant(String tenantId);
}
