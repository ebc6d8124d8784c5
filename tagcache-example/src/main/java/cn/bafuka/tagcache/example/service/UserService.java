package cn.bafuka.tagcache.example.service;

import cn.bafuka.tagcache.annotation.TagCacheFlush;
import cn.bafuka.tagcache.annotation.TaggedCacheable;
import cn.bafuka.tagcache.core.TaggedCache;
import cn.bafuka.tagcache.example.entity.User;
import cn.bafuka.tagcache.example.repository.InMemoryUserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * 用户服务
 * 演示 TagCache 的使用
 *
 * <p>标签约定：
 * <ul>
 *     <li>users：所有用户相关缓存</li>
 *     <li>user:{id}：单个用户</li>
 *     <li>department:{name}：部门成员列表</li>
 *     <li>user-list：全量用户列表，任何用户变更都要失效</li>
 * </ul>
 */
@Slf4j
@Service
public class UserService {

    @Autowired
    private InMemoryUserRepository userRepository;

    @Autowired
    private TaggedCache taggedCache;

    /**
     * 根据ID查询用户
     *
     * @param userId 用户ID
     * @return 用户信息
     */
    @TaggedCacheable(tags = {"users", "'user:' + #userId"}, key = "'detail:' + #userId", ttlSeconds = 600)
    public User getUserById(Long userId) {
        log.info("从仓库查询用户: userId={}", userId);
        // 模拟数据库查询延迟
        sleep(100);
        return userRepository.findById(userId);
    }

    /**
     * 查询部门成员（多个并发请求只回源一次）
     *
     * @param department 部门
     * @return 用户列表
     */
    @TaggedCacheable(tags = {"users", "'department:' + #department"}, key = "'department:' + #department",
            sync = true)
    public List<User> getUsersByDepartment(String department) {
        log.info("从仓库查询部门成员: department={}", department);
        sleep(100);
        return userRepository.findByDepartment(department);
    }

    /**
     * 查询所有用户
     *
     * @return 用户列表
     */
    @TaggedCacheable(tags = {"users", "user-list"}, key = "'all'", ttlSeconds = 60)
    public List<User> getAllUsers() {
        log.info("从仓库查询所有用户");
        return userRepository.findAll();
    }

    /**
     * 创建用户
     *
     * @param user 用户信息
     * @return 创建的用户
     */
    @TagCacheFlush(tags = {"user-list", "'department:' + #user.department"})
    public User createUser(User user) {
        user.setCreateTime(LocalDateTime.now());
        user.setUpdateTime(LocalDateTime.now());
        userRepository.save(user);
        log.info("用户创建成功: userId={}", user.getId());
        return user;
    }

    /**
     * 更新用户
     * 只失效该用户、全量列表和相关部门的缓存，其他用户的缓存不受影响
     *
     * @param user 用户信息
     */
    @TagCacheFlush(tags = {"'user:' + #user.id", "user-list", "'department:' + #user.department"})
    public void updateUser(User user) {
        User previous = userRepository.findById(user.getId());
        user.setUpdateTime(LocalDateTime.now());
        userRepository.save(user);

        // 调岗时原部门的成员列表也要失效
        if (previous != null && previous.getDepartment() != null
                && !Objects.equals(previous.getDepartment(), user.getDepartment())) {
            taggedCache.flush("department:" + previous.getDepartment());
        }
        log.info("用户更新成功: userId={}", user.getId());
    }

    /**
     * 删除用户，失效全部用户缓存
     *
     * @param userId 用户ID
     */
    @TagCacheFlush(tags = "users")
    public void deleteUser(Long userId) {
        userRepository.deleteById(userId);
        log.info("用户删除成功: userId={}", userId);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
