package cn.bafuka.tagcache.example.repository;

import cn.bafuka.tagcache.example.entity.User;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * 内存用户仓库
 * 代替真实数据库，方便示例独立运行
 */
@Repository
public class InMemoryUserRepository {

    private final Map<Long, User> users = new ConcurrentHashMap<>();

    private final AtomicLong idGenerator = new AtomicLong();

    public User findById(Long id) {
        User user = users.get(id);
        return user == null ? null : copy(user);
    }

    public List<User> findByDepartment(String department) {
        return users.values().stream()
                .filter(user -> department.equals(user.getDepartment()))
                .sorted(Comparator.comparing(User::getId))
                .map(this::copy)
                .collect(Collectors.toList());
    }

    public List<User> findAll() {
        List<User> result = new ArrayList<>();
        users.values().stream()
                .sorted(Comparator.comparing(User::getId))
                .forEach(user -> result.add(copy(user)));
        return result;
    }

    public User save(User user) {
        if (user.getId() == null) {
            user.setId(idGenerator.incrementAndGet());
        }
        users.put(user.getId(), copy(user));
        return user;
    }

    public boolean deleteById(Long id) {
        return users.remove(id) != null;
    }

    private User copy(User user) {
        return new User(user.getId(), user.getUsername(), user.getEmail(), user.getDepartment(),
                user.getCreateTime(), user.getUpdateTime());
    }
}
